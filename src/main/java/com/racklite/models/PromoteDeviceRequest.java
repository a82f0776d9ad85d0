package com.racklite.models;

import io.vertx.core.json.JsonObject;

import java.util.ArrayList;

import java.util.List;

/**
 * Data supplied by an operator to promote a discovered device.
 * Only name is required; everything else overrides discovered evidence.
 */
public class PromoteDeviceRequest
{

    public String deviceId;         // optional: use this ID for the new device

    public String name;

    public String description;

    public String makeModel;

    public String os;

    public String datacenterId;

    public String username;

    public String location;

    public List<String> tags = new ArrayList<>();

    public List<String> domains = new ArrayList<>();

    public PromoteDeviceRequest()
    {
    }

    public PromoteDeviceRequest(String name)
    {
        this.name = name;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("device_id", deviceId)
            .put("name", name)
            .put("description", description)
            .put("make_model", makeModel)
            .put("os", os)
            .put("datacenter_id", datacenterId)
            .put("username", username)
            .put("location", location)
            .put("tags", ModelJson.strings(tags))
            .put("domains", ModelJson.strings(domains));
    }

    public static PromoteDeviceRequest fromJson(JsonObject json)
    {
        var request = new PromoteDeviceRequest(json.getString("name"));

        request.deviceId = json.getString("device_id");

        request.description = json.getString("description");

        request.makeModel = json.getString("make_model");

        request.os = json.getString("os");

        request.datacenterId = json.getString("datacenter_id");

        request.username = json.getString("username");

        request.location = json.getString("location");

        request.tags = ModelJson.strings(json, "tags");

        request.domains = ModelJson.strings(json, "domains");

        return request;
    }
}
