package com.racklite.utils;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertThrows;

import static org.junit.jupiter.api.Assertions.assertTrue;

class SubnetUtilTest
{

    private static List<String> hosts(String cidr, List<String> exclusions)
    {
        var result = new ArrayList<String>();

        for (var ip : SubnetUtil.hostRange(cidr, exclusions))
        {
            result.add(ip);
        }

        return result;
    }

    @Test
    void slash24SkipsNetworkAndBroadcast()
    {
        var hosts = hosts("192.168.1.0/24", null);

        assertEquals(254, hosts.size());

        assertEquals(254, SubnetUtil.hostRange("192.168.1.0/24", null).size());

        assertEquals("192.168.1.1", hosts.get(0));

        assertEquals("192.168.1.254", hosts.get(253));
    }

    @Test
    void slash30HasTwoHosts()
    {
        assertEquals(List.of("10.0.0.1", "10.0.0.2"), hosts("10.0.0.0/30", null));
    }

    @Test
    void slash31AndSlash32KeepEveryAddress()
    {
        assertEquals(List.of("10.0.0.0", "10.0.0.1"), hosts("10.0.0.0/31", null));

        assertEquals(List.of("10.0.0.7"), hosts("10.0.0.7/32", null));
    }

    @Test
    void hostBitsInBaseAddressAreMasked()
    {
        assertEquals(List.of("10.0.0.1", "10.0.0.2"), hosts("10.0.0.3/30", null));
    }

    @Test
    void wideSubnetsAreCountedWithoutEnumerating()
    {
        assertEquals(131070, SubnetUtil.hostRange("10.0.0.0/15", null).size());

        assertEquals(16777214, SubnetUtil.hostRange("10.0.0.0/8", null).size());

        assertEquals(Integer.MAX_VALUE - 1, SubnetUtil.hostRange("0.0.0.0/1", null).size());

        var iterator = SubnetUtil.hostRange("10.0.0.0/8", null).iterator();

        assertEquals("10.0.0.1", iterator.next());

        assertEquals("10.0.0.2", iterator.next());

        assertThrows(IllegalArgumentException.class, () -> SubnetUtil.hostRange("0.0.0.0/0", null));
    }

    @Test
    void malformedSubnetsAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> SubnetUtil.hostRange("not-a-cidr", null));

        assertThrows(IllegalArgumentException.class, () -> SubnetUtil.hostRange("10.0.0.0/33", null));

        assertThrows(IllegalArgumentException.class, () -> SubnetUtil.hostRange("300.0.0.0/24", null));

        assertThrows(IllegalArgumentException.class, () -> SubnetUtil.hostRange("", null));
    }

    @Test
    void exclusionsMatchLiteralAndCidrEntries()
    {
        var exclusions = List.of("10.0.0.1", "10.0.0.8/29", "garbage", "192.168.0.0/16");

        var hosts = hosts("10.0.0.0/28", exclusions);

        assertEquals(List.of("10.0.0.2", "10.0.0.3", "10.0.0.4", "10.0.0.5", "10.0.0.6", "10.0.0.7"), hosts);

        assertEquals(hosts.size(), SubnetUtil.hostRange("10.0.0.0/28", exclusions).size());
    }

    @Test
    void overlappingAndAdjacentExclusionsAreCountedOnce()
    {
        var exclusions = List.of("10.0.0.0/26", "10.0.0.10", "10.0.0.64/27", "10.0.0.96", "10.0.0.255");

        var range = SubnetUtil.hostRange("10.0.0.0/24", exclusions);

        var hosts = hosts("10.0.0.0/24", exclusions);

        // .1-.63, .64-.95 and .96 are excluded; .255 is the broadcast address anyway
        assertEquals(254 - 63 - 32 - 1, range.size());

        assertEquals(range.size(), hosts.size());

        assertEquals("10.0.0.97", hosts.get(0));

        assertEquals("10.0.0.254", hosts.get(hosts.size() - 1));
    }

    @Test
    void fullyExcludedSubnetIsEmpty()
    {
        var range = SubnetUtil.hostRange("10.0.0.0/30", List.of("10.0.0.0/24"));

        assertEquals(0, range.size());

        assertFalse(range.iterator().hasNext());
    }

    @Test
    void validation()
    {
        assertTrue(SubnetUtil.isValidSingleIP("192.168.0.1"));

        assertFalse(SubnetUtil.isValidSingleIP("192.168.0"));

        assertTrue(SubnetUtil.isValidCidr("0.0.0.0/0"));

        assertFalse(SubnetUtil.isValidCidr("192.168.0.1"));
    }
}
