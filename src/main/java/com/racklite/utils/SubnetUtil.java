package com.racklite.utils;

import java.util.ArrayList;

import java.util.Comparator;

import java.util.Iterator;

import java.util.List;

import java.util.NoSuchElementException;

import java.util.regex.Pattern;

/**
 * SubnetUtil - Utility class for parsing IPv4 subnets and addresses

 * This utility supports:
 * - Single IP addresses: "192.168.1.100"
 * - CIDR subnets: "192.168.1.0/24" (expands to 192.168.1.1 through 192.168.1.254)

 * Features:
 * - IP and CIDR format validation
 * - Lazy subnet enumeration into candidate hosts for prefixes /1 through /32
 * - Exclusion of literal IPs and CIDR subnets, counted without enumerating

 * - IPv4 only; IPv6 subnets are rejected as not enumerable
 */
public class SubnetUtil
{

    private static final Pattern SINGLE_IP_PATTERN = Pattern.compile(
        "^((25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$"
    );

    private static final Pattern CIDR_PATTERN = Pattern.compile(
        "^((25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)/([0-9]|[12][0-9]|3[0-2])$"
    );

    private SubnetUtil()
    {
    }

    /**
     * Describe the candidate hosts of a CIDR subnet, minus exclusions, without materializing them.

     * When the prefix length is 30 or shorter the network and broadcast
     * addresses are left out; /31 and /32 keep every address.
     * Host bits set in the input address are ignored ("10.0.0.7/24" is "10.0.0.0/24").
     * Exclusion entries may be literal IPs or CIDR subnets; malformed entries never match.
     *
     * @param cidr Subnet in CIDR notation
     * @param excludeList Exclusion entries (may be null)
     * @return Lazily enumerated host range in ascending order
     * @throws IllegalArgumentException if the subnet is not valid IPv4 CIDR or its host count does not fit an int (/0)
     */
    public static HostRange hostRange(String cidr, List<String> excludeList)
    {
        if (cidr == null || cidr.trim().isEmpty())
        {
            throw new IllegalArgumentException("Subnet cannot be null or empty");
        }

        cidr = cidr.trim();

        if (!isValidCidr(cidr))
        {
            throw new IllegalArgumentException("Invalid CIDR subnet: " + cidr +
                ". Expected format: '192.168.1.0/24'");
        }

        var parts = cidr.split("/");

        var prefix = Integer.parseInt(parts[1]);

        var network = ipToLong(parts[0]) & prefixMask(prefix);

        var first = network;

        var last = network + (1L << (32 - prefix)) - 1;

        // Skip network and broadcast addresses for /30 and shorter prefixes
        if (prefix <= 30)
        {
            first++;

            last--;
        }

        if (last - first + 1 > Integer.MAX_VALUE)
        {
            throw new IllegalArgumentException("Subnet too large to scan: " + cidr +
                " (" + (last - first + 1) + " hosts, limit " + Integer.MAX_VALUE + ")");
        }

        return new HostRange(first, last, exclusionIntervals(excludeList, first, last));
    }

    /**
     * Exclusions as sorted, merged, non-adjacent [low, high] intervals clipped to the range.
     */
    private static List<long[]> exclusionIntervals(List<String> excludeList, long first, long last)
    {
        var intervals = new ArrayList<long[]>();

        if (excludeList == null)
        {
            return intervals;
        }

        for (var entry : excludeList)
        {
            if (entry == null)
            {
                continue;
            }

            var exclusion = entry.trim();

            long low;

            long high;

            if (isValidSingleIP(exclusion))
            {
                low = ipToLong(exclusion);

                high = low;
            }
            else if (isValidCidr(exclusion))
            {
                var parts = exclusion.split("/");

                var prefix = Integer.parseInt(parts[1]);

                low = ipToLong(parts[0]) & prefixMask(prefix);

                high = low + (1L << (32 - prefix)) - 1;
            }
            else
            {
                continue;
            }

            low = Math.max(low, first);

            high = Math.min(high, last);

            if (low <= high)
            {
                intervals.add(new long[]{low, high});
            }
        }

        intervals.sort(Comparator.comparingLong(interval -> interval[0]));

        var merged = new ArrayList<long[]>();

        for (var interval : intervals)
        {
            var previous = merged.isEmpty() ? null : merged.get(merged.size() - 1);

            if (previous != null && interval[0] <= previous[1] + 1)
            {
                previous[1] = Math.max(previous[1], interval[1]);
            }
            else
            {
                merged.add(interval);
            }
        }

        return merged;
    }

    /**
     * Validate if a string is a valid single IP address
     *
     * @param ip The IP address string to validate
     * @return true if valid, false otherwise
     */
    public static boolean isValidSingleIP(String ip)
    {
        if (ip == null || ip.trim().isEmpty())
        {
            return false;
        }

        return SINGLE_IP_PATTERN.matcher(ip.trim()).matches();
    }

    /**
     * Validate if a string is a valid IPv4 CIDR subnet
     *
     * @param cidr The subnet string to validate (e.g., "10.0.0.0/8")
     * @return true if valid, false otherwise
     */
    public static boolean isValidCidr(String cidr)
    {
        if (cidr == null || cidr.trim().isEmpty())
        {
            return false;
        }

        return CIDR_PATTERN.matcher(cidr.trim()).matches();
    }

    private static long prefixMask(int prefix)
    {
        if (prefix == 0)
        {
            return 0L;
        }

        return (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
    }

    private static long ipToLong(String ip)
    {
        var octets = ip.split("\\.");

        var value = 0L;

        for (var octet : octets)
        {
            value = (value << 8) | Integer.parseInt(octet);
        }

        return value;
    }

    private static String longToIp(long value)
    {
        return ((value >> 24) & 0xFF) + "." + ((value >> 16) & 0xFF) + "." + ((value >> 8) & 0xFF) + "." + (value & 0xFF);
    }

    /**
     * Ascending host addresses of one subnet with exclusions removed.
     * Iteration computes each address on demand; nothing proportional to the subnet size is held.
     */
    public static final class HostRange implements Iterable<String>
    {

        private final long first;

        private final long last;

        private final List<long[]> excluded;

        private HostRange(long first, long last, List<long[]> excluded)
        {
            this.first = first;

            this.last = last;

            this.excluded = excluded;
        }

        /**
         * Number of hosts iteration yields.
         *
         * @return host count after exclusions
         */
        public int size()
        {
            var count = last - first + 1;

            for (var interval : excluded)
            {
                count -= interval[1] - interval[0] + 1;
            }

            return (int) count;
        }

        @Override
        public Iterator<String> iterator()
        {
            return new HostIterator();
        }

        private final class HostIterator implements Iterator<String>
        {

            private long next = first;

            private int intervalIndex;

            private HostIterator()
            {
                skipExcluded();
            }

            // Intervals are merged and non-adjacent, so one jump always lands on an included address
            private void skipExcluded()
            {
                while (intervalIndex < excluded.size() && excluded.get(intervalIndex)[1] < next)
                {
                    intervalIndex++;
                }

                if (intervalIndex < excluded.size() && excluded.get(intervalIndex)[0] <= next)
                {
                    next = excluded.get(intervalIndex)[1] + 1;

                    intervalIndex++;
                }
            }

            @Override
            public boolean hasNext()
            {
                return next <= last;
            }

            @Override
            public String next()
            {
                if (!hasNext())
                {
                    throw new NoSuchElementException();
                }

                var ip = longToIp(next);

                next++;

                skipExcluded();

                return ip;
            }
        }
    }
}
