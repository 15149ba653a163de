package com.edgegate.gateway.realtime;

import com.edgegate.common.security.UserPrincipal;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.config.GatewayProperties.ChannelAccess;
import com.edgegate.gateway.config.GatewayProperties.ChannelRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ChannelAccessPolicyTest {

    private ChannelAccessPolicy policy;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getRealtime().setChannels(List.of(
                new ChannelRule("market.*", ChannelAccess.PUBLIC, List.of(), null),
                new ChannelRule("market.depth.*", ChannelAccess.TIER, List.of("premium", "enterprise"), null),
                new ChannelRule("market.depth.summary", ChannelAccess.PUBLIC, List.of(), null),
                new ChannelRule("portfolio.*", ChannelAccess.PERMISSION, List.of(), "portfolio:read")));
        policy = new ChannelAccessPolicy(properties);
    }

    private static UserPrincipal user(String tier, String... permissions) {
        return UserPrincipal.builder()
                .subject("u1")
                .roles(List.of("USER"))
                .tier(tier)
                .permissions(List.of(permissions))
                .build();
    }

    @Test
    void testPublicChannelsAreOpenToAnonymous() {
        assertEquals(AccessDecision.ALLOWED, policy.decide(UserPrincipal.anonymous(), "market.BTC"));
        assertEquals(AccessDecision.ALLOWED, policy.decide(null, "market.ETH"));
    }

    @Test
    void testLongestPrefixAndExactRulesWin() {
        assertEquals(AccessDecision.TIER_REQUIRED, policy.decide(user("basic"), "market.depth.BTC"));
        assertEquals(AccessDecision.ALLOWED, policy.decide(user("Premium"), "market.depth.BTC"));
        assertEquals(AccessDecision.ALLOWED, policy.decide(user("basic"), "market.depth.summary"));
    }

    @Test
    void testPermissionChannels() {
        assertEquals(AccessDecision.PERMISSION_REQUIRED, policy.decide(user("enterprise"), "portfolio.u1"));
        assertTrue(policy.canSubscribe(user(null, "portfolio:read"), "portfolio.u1"));
    }

    @Test
    void testSystemChannelsRequireOpsPermission() {
        assertEquals(AccessDecision.PERMISSION_REQUIRED, policy.decide(user("enterprise"), "system.health"));
        assertTrue(policy.canSubscribe(user(null, ChannelAccessPolicy.OPS_PERMISSION), "system.circuits"));
    }

    @Test
    void testUnknownAndMalformedChannels() {
        assertEquals(AccessDecision.UNKNOWN_CHANNEL, policy.decide(user("premium"), "orders.all"));
        assertEquals(AccessDecision.UNKNOWN_CHANNEL, policy.decide(user("premium"), "market"));
        assertEquals(AccessDecision.INVALID_CHANNEL, policy.decide(user("premium"), "market..BTC"));
        assertEquals(AccessDecision.INVALID_CHANNEL, policy.decide(user("premium"), "market.*"));
        assertEquals(AccessDecision.INVALID_CHANNEL, policy.decide(user("premium"), ""));
        assertEquals(AccessDecision.INVALID_CHANNEL, policy.decide(user("premium"), null));
    }
}
