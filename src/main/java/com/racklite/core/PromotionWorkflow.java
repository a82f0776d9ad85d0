package com.racklite.core;

import com.racklite.models.Address;

import com.racklite.models.BulkPromoteResult;

import com.racklite.models.Datacenter;

import com.racklite.models.Device;

import com.racklite.models.DiscoveredDevice;

import com.racklite.models.PromoteDeviceRequest;

import com.racklite.services.DiscoveryService;

import com.racklite.utils.DiscoveryValidationUtil;

import io.vertx.core.Future;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

import java.util.UUID;

/**
 * PromotionWorkflow - Turns discovered devices into managed inventory devices

 * Single promotion validates the request and delegates to the store, which
 * performs the whole promotion in one transaction. Bulk promotion runs the
 * single path once per ID, sequentially; a failure is collected and never
 * rolls back or stops the siblings.

 * The device-building rules are static so both store implementations apply
 * exactly the same mapping.
 */
public class PromotionWorkflow
{

    private static final Logger logger = LoggerFactory.getLogger(PromotionWorkflow.class);

    private static final String DEFAULT_NAME_PREFIX = "device-";

    private final DiscoveryService discoveryService;

    public PromotionWorkflow(DiscoveryService discoveryService)
    {
        this.discoveryService = discoveryService;
    }

    /**
     * Promote one discovered device.
     *
     * @param discoveredId Discovered device ID
     * @param request Operator supplied data (name required)
     * @return Future containing the created device
     */
    public Future<Device> promote(String discoveredId, PromoteDeviceRequest request)
    {
        try
        {
            var validationError = DiscoveryValidationUtil.validatePromoteRequest(request);

            if (validationError != null)
            {
                return Future.failedFuture(DiscoveryException.invalidRequest(validationError));
            }

            if (discoveredId == null || discoveredId.isBlank())
            {
                return Future.failedFuture(DiscoveryException.invalidRequest("discovered device id is required"));
            }

            return discoveryService.discoveredPromote(discoveredId, request)
                .onSuccess(device ->
                    logger.info("Promoted discovered device {} to device {} ({})", discoveredId, device.id, device.name))
                .onFailure(cause ->
                    logger.warn("Promotion of discovered device {} failed: {}", discoveredId, cause.getMessage()));
        }
        catch (Exception exception)
        {
            logger.error("Error in promote: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    /**
     * Promote several discovered devices independently.
     * requests.get(i) pairs with ids.get(i); a missing request defaults to the name "device-&lt;id&gt;".
     *
     * @param ids Discovered device IDs
     * @param requests Requests aligned with ids (may be shorter, null, or contain nulls)
     * @return Future that always succeeds with the successes and per-ID errors
     */
    public Future<BulkPromoteResult> bulkPromote(List<String> ids, List<PromoteDeviceRequest> requests)
    {
        var result = new BulkPromoteResult();

        if (ids == null || ids.isEmpty())
        {
            return Future.succeededFuture(result);
        }

        Future<Void> chain = Future.succeededFuture();

        for (var index = 0; index < ids.size(); index++)
        {
            var id = ids.get(index);

            var request = requestAt(requests, index, id);

            chain = chain.compose(v -> promote(id, request)
                .transform(promotion ->
                {
                    if (promotion.succeeded())
                    {
                        result.promoted.add(promotion.result());
                    }
                    else
                    {
                        result.errors.add(describe(id, promotion.cause()));
                    }

                    return Future.<Void>succeededFuture();
                }));
        }

        return chain
            .map(v -> result)
            .onSuccess(bulk ->
                logger.info("Bulk promotion finished: {} promoted, {} failed", bulk.promoted.size(), bulk.errors.size()));
    }

    // ===== Pure building rules shared by the store implementations =====

    /**
     * Datacenter auto-assignment: the requested one if given, otherwise the only
     * datacenter in the store, otherwise none.
     *
     * @param request Promotion request
     * @param datacenters All datacenters in the store
     * @return Datacenter ID or null
     */
    public static String resolveDatacenterId(PromoteDeviceRequest request, List<Datacenter> datacenters)
    {
        if (request.datacenterId != null && !request.datacenterId.isBlank())
        {
            return request.datacenterId;
        }

        if (datacenters != null && datacenters.size() == 1)
        {
            return datacenters.get(0).id;
        }

        return null;
    }

    /**
     * Build the inventory device for a promotion. Nothing is persisted.
     *
     * @param discovered Source discovered device
     * @param request Operator supplied data
     * @param datacenterId Resolved datacenter (see {@link #resolveDatacenterId})
     * @param now Creation time
     * @return Device with exactly one discovered-origin address
     */
    public static Device buildDevice(DiscoveredDevice discovered, PromoteDeviceRequest request, String datacenterId, Instant now)
    {
        var device = new Device();

        device.id = request.deviceId != null && !request.deviceId.isBlank()
            ? request.deviceId
            : UUID.randomUUID().toString();

        device.name = request.name.trim();

        device.description = request.description;

        device.makeModel = request.makeModel;

        device.os = request.os != null && !request.os.isBlank() ? request.os : discovered.osGuess;

        device.datacenterId = datacenterId;

        device.username = request.username;

        device.location = request.location;

        device.tags = request.tags != null ? new ArrayList<>(request.tags) : new ArrayList<>();

        device.domains = request.domains != null ? new ArrayList<>(request.domains) : new ArrayList<>();

        var address = new Address();

        address.ip = discovered.ip;

        address.type = Address.TYPE_IPV4;

        address.label = Address.LABEL_DISCOVERED;

        address.networkId = discovered.networkId;

        device.addresses.add(address);

        device.createdAt = now;

        device.updatedAt = now;

        return device;
    }

    private static PromoteDeviceRequest requestAt(List<PromoteDeviceRequest> requests, int index, String id)
    {
        if (requests != null && index < requests.size() && requests.get(index) != null)
        {
            return requests.get(index);
        }

        return new PromoteDeviceRequest(DEFAULT_NAME_PREFIX + id);
    }

    private static Throwable describe(String id, Throwable cause)
    {
        var kind = cause instanceof DiscoveryException
            ? ((DiscoveryException) cause).kind()
            : DiscoveryException.Kind.STORAGE;

        return new DiscoveryException(kind, "promote " + id + ": " + cause.getMessage(), cause);
    }
}
