package com.racklite.models;

import io.vertx.core.json.JsonObject;

/**
 * A network address attached to an inventory device.
 */
public class Address
{

    public static final String TYPE_IPV4 = "ipv4";

    public static final String LABEL_DISCOVERED = "discovered";

    public String ip;

    public int port;

    public String type;             // ipv4, ipv6

    public String label;            // management, data, discovered

    public String networkId;

    public String switchPort;       // eth0, Gi1/0/1

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("ip", ip)
            .put("port", port)
            .put("type", type)
            .put("label", label)
            .put("network_id", networkId)
            .put("switch_port", switchPort);
    }

    public static Address fromJson(JsonObject json)
    {
        var address = new Address();

        address.ip = json.getString("ip");

        address.port = json.getInteger("port", 0);

        address.type = json.getString("type");

        address.label = json.getString("label");

        address.networkId = json.getString("network_id");

        address.switchPort = json.getString("switch_port");

        return address;
    }
}
