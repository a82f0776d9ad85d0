package com.racklite.models;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * A datacenter location. Promotion auto-assigns the only datacenter when
 * exactly one exists.
 */
public class Datacenter
{

    public String id;

    public String name;

    public String location;

    public String description;

    public Instant createdAt;

    public Instant updatedAt;

    public Datacenter()
    {
    }

    public Datacenter(String id, String name)
    {
        this.id = id;

        this.name = name;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("id", id)
            .put("name", name)
            .put("location", location)
            .put("description", description)
            .put("created_at", ModelJson.instant(createdAt))
            .put("updated_at", ModelJson.instant(updatedAt));
    }

    public static Datacenter fromJson(JsonObject json)
    {
        var datacenter = new Datacenter(json.getString("id"), json.getString("name"));

        datacenter.location = json.getString("location");

        datacenter.description = json.getString("description");

        datacenter.createdAt = ModelJson.instant(json, "created_at");

        datacenter.updatedAt = ModelJson.instant(json, "updated_at");

        return datacenter;
    }
}
