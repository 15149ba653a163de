package com.edgegate.gateway.router;

import com.edgegate.gateway.config.GatewayProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

/**
 * Sends everything under the API prefix through {@link GatewayRouteHandler}
 */
@Configuration
public class RouterConfig {

    @Bean
    public RouterFunction<ServerResponse> gatewayRoutes(GatewayRouteHandler handler, GatewayProperties properties) {
        String prefix = properties.getProxy().getApiPrefix();
        return RouterFunctions.route(RequestPredicates.path(prefix + "/**"), handler::handle);
    }
}
