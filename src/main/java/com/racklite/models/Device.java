package com.racklite.models;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

/**
 * A managed inventory device. Discovery creates these only through promotion.
 */
public class Device
{

    public String id;

    public String name;

    public String description;

    public String makeModel;

    public String os;

    public String datacenterId;

    public String username;

    public String location;

    public List<String> tags = new ArrayList<>();

    public List<Address> addresses = new ArrayList<>();

    public List<String> domains = new ArrayList<>();

    public Instant createdAt;

    public Instant updatedAt;

    public JsonObject toJson()
    {
        var addressArray = new JsonArray();

        for (var address : addresses)
        {
            addressArray.add(address.toJson());
        }

        return new JsonObject()
            .put("id", id)
            .put("name", name)
            .put("description", description)
            .put("make_model", makeModel)
            .put("os", os)
            .put("datacenter_id", datacenterId)
            .put("username", username)
            .put("location", location)
            .put("tags", ModelJson.strings(tags))
            .put("addresses", addressArray)
            .put("domains", ModelJson.strings(domains))
            .put("created_at", ModelJson.instant(createdAt))
            .put("updated_at", ModelJson.instant(updatedAt));
    }

    public static Device fromJson(JsonObject json)
    {
        var device = new Device();

        device.id = json.getString("id");

        device.name = json.getString("name");

        device.description = json.getString("description");

        device.makeModel = json.getString("make_model");

        device.os = json.getString("os");

        device.datacenterId = json.getString("datacenter_id");

        device.username = json.getString("username");

        device.location = json.getString("location");

        device.tags = ModelJson.strings(json, "tags");

        device.domains = ModelJson.strings(json, "domains");

        var addressArray = json.getJsonArray("addresses", new JsonArray());

        for (var i = 0; i < addressArray.size(); i++)
        {
            device.addresses.add(Address.fromJson(addressArray.getJsonObject(i)));
        }

        device.createdAt = ModelJson.instant(json, "created_at");

        device.updatedAt = ModelJson.instant(json, "updated_at");

        return device;
    }
}
