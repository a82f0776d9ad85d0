package com.racklite.models;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * A network subnet in a datacenter.
 * Owned by the inventory; the scanner only reads id and subnet.
 */
public class Network
{

    public String id;

    public String name;

    public String subnet;           // CIDR notation, e.g. 192.168.1.0/24

    public String datacenterId;

    public String description;

    public Instant createdAt;

    public Instant updatedAt;

    public Network()
    {
    }

    public Network(String id, String name, String subnet, String datacenterId)
    {
        this.id = id;

        this.name = name;

        this.subnet = subnet;

        this.datacenterId = datacenterId;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("id", id)
            .put("name", name)
            .put("subnet", subnet)
            .put("datacenter_id", datacenterId)
            .put("description", description)
            .put("created_at", ModelJson.instant(createdAt))
            .put("updated_at", ModelJson.instant(updatedAt));
    }

    public static Network fromJson(JsonObject json)
    {
        var network = new Network(json.getString("id"), json.getString("name"),
            json.getString("subnet"), json.getString("datacenter_id"));

        network.description = json.getString("description");

        network.createdAt = ModelJson.instant(json, "created_at");

        network.updatedAt = ModelJson.instant(json, "updated_at");

        return network;
    }
}
