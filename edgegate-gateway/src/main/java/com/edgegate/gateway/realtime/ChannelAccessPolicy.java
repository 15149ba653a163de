package com.edgegate.gateway.realtime;

import com.edgegate.common.security.UserPrincipal;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.config.GatewayProperties.ChannelAccess;
import com.edgegate.gateway.config.GatewayProperties.ChannelRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Static channel to capability table.
 *
 * Rules are exact channel names or prefixes ending in {@code .*}. An exact rule
 * wins over a prefix rule; among prefix rules the longest wins. Channels without
 * a rule are rejected. The system health and circuit channels require
 * {@value #OPS_PERMISSION} unless configured otherwise.
 */
@Slf4j
@Component
public class ChannelAccessPolicy {

    public static final String OPS_PERMISSION = "ops:read";

    private static final Pattern CHANNEL_NAME = Pattern.compile("[A-Za-z0-9_\\-]+(\\.[A-Za-z0-9_\\-]+)*");

    private final Map<String, ChannelRule> exactRules = new HashMap<>();
    private final List<ChannelRule> prefixRules = new ArrayList<>();

    public ChannelAccessPolicy(GatewayProperties properties) {
        GatewayProperties.Realtime realtime = properties.getRealtime();
        for (ChannelRule rule : realtime.getChannels()) {
            String pattern = rule.getPattern() == null ? "" : rule.getPattern().trim();
            if (pattern.endsWith(".*")) {
                prefixRules.add(rule);
            } else if (!pattern.isEmpty()) {
                exactRules.put(pattern, rule);
            }
        }
        prefixRules.sort((a, b) -> Integer.compare(b.getPattern().trim().length(), a.getPattern().trim().length()));

        exactRules.putIfAbsent(realtime.getHealthChannel(),
                new ChannelRule(realtime.getHealthChannel(), ChannelAccess.PERMISSION, List.of(), OPS_PERMISSION));
        exactRules.putIfAbsent(realtime.getCircuitChannel(),
                new ChannelRule(realtime.getCircuitChannel(), ChannelAccess.PERMISSION, List.of(), OPS_PERMISSION));

        log.info("Channel access policy: {} exact rules, {} prefix rules", exactRules.size(), prefixRules.size());
    }

    public boolean canSubscribe(UserPrincipal principal, String channel) {
        return decide(principal, channel).isAllowed();
    }

    public AccessDecision decide(UserPrincipal principal, String channel) {
        if (channel == null || !CHANNEL_NAME.matcher(channel).matches()) {
            return AccessDecision.INVALID_CHANNEL;
        }
        ChannelRule rule = ruleFor(channel);
        if (rule == null) {
            return AccessDecision.UNKNOWN_CHANNEL;
        }

        UserPrincipal identity = principal != null ? principal : UserPrincipal.anonymous();
        ChannelAccess access = rule.getAccess() != null ? rule.getAccess() : ChannelAccess.PUBLIC;
        switch (access) {
            case TIER:
                for (String tier : rule.getTiers()) {
                    if (identity.hasTier(tier)) {
                        return AccessDecision.ALLOWED;
                    }
                }
                return AccessDecision.TIER_REQUIRED;
            case PERMISSION:
                return identity.hasPermission(rule.getPermission())
                        ? AccessDecision.ALLOWED
                        : AccessDecision.PERMISSION_REQUIRED;
            default:
                return AccessDecision.ALLOWED;
        }
    }

    ChannelRule ruleFor(String channel) {
        ChannelRule exact = exactRules.get(channel);
        if (exact != null) {
            return exact;
        }
        for (ChannelRule rule : prefixRules) {
            String pattern = rule.getPattern().trim();
            String prefix = pattern.substring(0, pattern.length() - 1);
            if (channel.startsWith(prefix) && channel.length() > prefix.length()) {
                return rule;
            }
        }
        return null;
    }
}
