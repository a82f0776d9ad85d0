package com.racklite.utils;

import com.racklite.models.DiscoveryRule;

import com.racklite.models.PromoteDeviceRequest;

import java.util.Set;

/**
 * DiscoveryValidationUtil - Validation for discovery rules and promotion requests

 * Validates:
 * - Promotion requests: name required, field lengths
 * - Discovery rules: network reference, scan type, port scan type,
 *   timeout/concurrency/interval bounds, custom ports, exclusion entries

 * All methods return null if validation passes, otherwise the first error message.
 * Callers turn the message into a DiscoveryException(INVALID_REQUEST).
 */
public class DiscoveryValidationUtil
{

    public static final int MAX_NAME_LENGTH = 255;

    public static final int MAX_TIMEOUT_SECONDS = 300;

    public static final int MAX_CONCURRENT_SCANS = 256;

    private static final Set<String> SCAN_TYPES = Set.of(
        DiscoveryRule.SCAN_TYPE_QUICK, DiscoveryRule.SCAN_TYPE_FULL, DiscoveryRule.SCAN_TYPE_DEEP);

    private static final Set<String> PORT_SCAN_TYPES = Set.of("common", "full", "custom");

    private DiscoveryValidationUtil()
    {
    }

    // ========================================
    // PROMOTION
    // ========================================

    /**
     * Validate a promotion request
     *
     * @param request Request to validate
     * @return null if valid, error message otherwise
     */
    public static String validatePromoteRequest(PromoteDeviceRequest request)
    {
        if (request == null)
        {
            return "promotion request is required";
        }

        if (request.name == null || request.name.trim().isEmpty())
        {
            return "name is required";
        }

        if (request.name.length() > MAX_NAME_LENGTH)
        {
            return "name must be " + MAX_NAME_LENGTH + " characters or less";
        }

        if (request.tags != null && request.tags.stream().anyMatch(tag -> tag == null || tag.isBlank()))
        {
            return "tags cannot contain empty values";
        }

        if (request.domains != null && request.domains.stream().anyMatch(domain -> domain == null || domain.isBlank()))
        {
            return "domains cannot contain empty values";
        }

        return null;
    }

    // ========================================
    // RULES
    // ========================================

    /**
     * Validate a discovery rule. Zero timeout and concurrency mean "use the default".
     *
     * @param rule Rule to validate
     * @return null if valid, error message otherwise
     */
    public static String validateRule(DiscoveryRule rule)
    {
        if (rule == null)
        {
            return "discovery rule is required";
        }

        if (rule.networkId == null || rule.networkId.trim().isEmpty())
        {
            return "network_id is required";
        }

        if (rule.scanType == null || !SCAN_TYPES.contains(rule.scanType))
        {
            return "scan_type must be one of " + SCAN_TYPES;
        }

        if (rule.portScanType != null && !PORT_SCAN_TYPES.contains(rule.portScanType))
        {
            return "port_scan_type must be one of " + PORT_SCAN_TYPES;
        }

        if (rule.timeoutSeconds < 0 || rule.timeoutSeconds > MAX_TIMEOUT_SECONDS)
        {
            return "timeout_seconds must be between 1 and " + MAX_TIMEOUT_SECONDS;
        }

        if (rule.maxConcurrentScans < 0 || rule.maxConcurrentScans > MAX_CONCURRENT_SCANS)
        {
            return "max_concurrent_scans must be between 1 and " + MAX_CONCURRENT_SCANS;
        }

        if (rule.scanIntervalHours < 0)
        {
            return "scan_interval_hours cannot be negative";
        }

        if (rule.customPorts != null)
        {
            for (var port : rule.customPorts)
            {
                if (port == null || port < 1 || port > 65535)
                {
                    return "custom_ports must be between 1 and 65535";
                }
            }
        }

        if (rule.excludeIps != null)
        {
            for (var entry : rule.excludeIps)
            {
                if (!SubnetUtil.isValidSingleIP(entry) && !SubnetUtil.isValidCidr(entry))
                {
                    return "exclude_ips entry is not an IP or CIDR: " + entry;
                }
            }
        }

        return null;
    }

}
