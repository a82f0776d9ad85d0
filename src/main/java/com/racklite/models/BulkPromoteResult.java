package com.racklite.models;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import java.util.ArrayList;

import java.util.List;

/**
 * Outcome of a bulk promotion: every success and every per-ID failure.
 */
public class BulkPromoteResult
{

    public final List<Device> promoted = new ArrayList<>();

    public final List<Throwable> errors = new ArrayList<>();

    public JsonObject toJson()
    {
        var promotedArray = new JsonArray();

        for (var device : promoted)
        {
            promotedArray.add(device.toJson());
        }

        var errorArray = new JsonArray();

        for (var error : errors)
        {
            errorArray.add(error.getMessage());
        }

        return new JsonObject()
            .put("promoted", promotedArray)
            .put("errors", errorArray)
            .put("promoted_count", promoted.size())
            .put("error_count", errors.size());
    }
}
