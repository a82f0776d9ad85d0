package com.racklite.models;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

/**
 * Shared JSON conversion helpers for the model classes.
 * Timestamps travel as ISO-8601 strings, lists as JsonArray.
 */
final class ModelJson
{

    private ModelJson()
    {
    }

    static String instant(Instant value)
    {
        return value != null ? value.toString() : null;
    }

    static Instant instant(JsonObject json, String key)
    {
        var value = json.getString(key);

        return value != null && !value.isBlank() ? Instant.parse(value) : null;
    }

    static JsonArray strings(List<String> values)
    {
        return values != null ? new JsonArray(new ArrayList<>(values)) : new JsonArray();
    }

    static List<String> strings(JsonObject json, String key)
    {
        var result = new ArrayList<String>();

        var array = json.getJsonArray(key);

        if (array != null)
        {
            for (var i = 0; i < array.size(); i++)
            {
                result.add(array.getString(i));
            }
        }

        return result;
    }

    static JsonArray integers(List<Integer> values)
    {
        return values != null ? new JsonArray(new ArrayList<>(values)) : new JsonArray();
    }

    static List<Integer> integers(JsonObject json, String key)
    {
        var result = new ArrayList<Integer>();

        var array = json.getJsonArray(key);

        if (array != null)
        {
            for (var i = 0; i < array.size(); i++)
            {
                result.add(array.getInteger(i));
            }
        }

        return result;
    }

}
