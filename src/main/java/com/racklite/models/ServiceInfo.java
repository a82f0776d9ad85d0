package com.racklite.models;

import io.vertx.core.json.JsonObject;

/**
 * A service detected on an open port.
 * The baseline engine never fills these; premium scanners do.
 */
public class ServiceInfo
{

    public int port;

    public String protocol;     // tcp, udp

    public String service;      // ssh, http, ...

    public String version;

    public String product;

    public String banner;

    public ServiceInfo copy()
    {
        var copy = new ServiceInfo();

        copy.port = port;

        copy.protocol = protocol;

        copy.service = service;

        copy.version = version;

        copy.product = product;

        copy.banner = banner;

        return copy;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("port", port)
            .put("protocol", protocol)
            .put("service", service)
            .put("version", version)
            .put("product", product)
            .put("banner", banner);
    }

    public static ServiceInfo fromJson(JsonObject json)
    {
        var info = new ServiceInfo();

        info.port = json.getInteger("port", 0);

        info.protocol = json.getString("protocol");

        info.service = json.getString("service");

        info.version = json.getString("version");

        info.product = json.getString("product");

        info.banner = json.getString("banner");

        return info;
    }
}
