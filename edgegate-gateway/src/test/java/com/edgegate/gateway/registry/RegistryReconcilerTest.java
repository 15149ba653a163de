package com.edgegate.gateway.registry;

import com.edgegate.common.model.InstanceSource;
import com.edgegate.common.model.ServiceInstance;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.registry.discovery.DiscoveryBackend;
import com.edgegate.gateway.registry.discovery.StaticDiscoveryBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class RegistryReconcilerTest {

    @Mock
    private HealthProbe healthProbe;

    private GatewayProperties properties;
    private InMemoryServiceRegistry registry;
    private StaticDiscoveryBackend backend;
    private HealthCheckScheduler scheduler;
    private RegistryReconciler reconciler;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        GatewayProperties.StaticInstance configured = new GatewayProperties.StaticInstance();
        configured.setId("p1");
        configured.setServiceName("pricing");
        configured.setAddress("10.0.0.1");
        configured.setPort(8080);
        properties.getRegistry().getStaticInstances().add(configured);

        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        registry = new InMemoryServiceRegistry(event -> { });
        backend = new StaticDiscoveryBackend(properties);
        scheduler = new HealthCheckScheduler(registry, healthProbe, properties, clock);
        reconciler = new RegistryReconciler(registry, backend, scheduler, properties);
    }

    private static ServiceInstance instance(String service, String id) {
        return ServiceInstance.builder().id(id).serviceName(service).address("10.0.0.2").port(9000).build();
    }

    @Test
    void testNewInstancesAreAddedAndProbedImmediately() {
        when(healthProbe.probe(any())).thenReturn(Mono.just(true));

        ReconciliationResult result = reconciler.reconcile();

        assertEquals(1, result.getAdded());
        ServiceInstance added = registry.listInstances("pricing").get(0);
        assertEquals(InstanceSource.DISCOVERY, added.getSource());
        assertTrue(added.isHealthy());
        assertEquals("p1", registry.pick("pricing").getId());
    }

    @Test
    void testUnhealthyNewInstanceIsNotPickable() {
        when(healthProbe.probe(any())).thenReturn(Mono.just(false));

        reconciler.reconcile();

        assertEquals(1, registry.listInstances("pricing").size());
        assertTrue(registry.listHealthy("pricing").isEmpty());
    }

    @Test
    void testInstancesDroppedByBackendAreRemoved() {
        when(healthProbe.probe(any())).thenReturn(Mono.just(true));
        reconciler.reconcile();

        backend.deregister(registry.listInstances("pricing").get(0));
        ReconciliationResult result = reconciler.reconcile();

        assertEquals(1, result.getRemoved());
        assertTrue(registry.listInstances("pricing").isEmpty());
    }

    @Test
    void testRegisteredInstancesSurviveReconciliation() {
        when(healthProbe.probe(any())).thenReturn(Mono.just(true));
        registry.register(instance("quotes", "q1"));

        reconciler.reconcile();

        assertEquals(1, registry.listInstances("quotes").size());
    }

    @Test
    void testInstancesMissingTooManyChecksAreEvicted() {
        registry.register(instance("quotes", "q1"));
        for (int i = 0; i < properties.getRegistry().getMaxMissedChecks(); i++) {
            registry.recordProbe("quotes", "q1", false, Instant.now());
        }
        when(healthProbe.probe(any())).thenReturn(Mono.just(true));

        ReconciliationResult result = reconciler.reconcile();

        assertEquals(1, result.getEvicted());
        assertTrue(registry.listInstances("quotes").isEmpty());
        assertEquals(1, registry.listInstances("pricing").size());
    }

    @Test
    void testBackendFailureKeepsCatalog() {
        DiscoveryBackend failing = mock(DiscoveryBackend.class);
        when(failing.name()).thenReturn("consul");
        when(failing.listAllServices()).thenThrow(new IllegalStateException("consul down"));
        RegistryReconciler withFailingBackend = new RegistryReconciler(registry, failing, scheduler, properties);

        registry.register(instance("quotes", "q1").toBuilder().source(InstanceSource.DISCOVERY).build());
        ReconciliationResult result = withFailingBackend.reconcile();

        assertEquals(new ReconciliationResult(0, 0, 0), result);
        assertEquals(1, registry.listInstances("quotes").size());
        verify(healthProbe, never()).probe(any());
    }

    @Test
    void testHealthCheckRecordsEveryInstance() {
        registry.register(instance("quotes", "q1"));
        registry.register(instance("quotes", "q2").toBuilder().port(9001).build());
        when(healthProbe.probe(any())).thenAnswer(invocation -> {
            ServiceInstance probed = invocation.getArgument(0);
            return Mono.just(probed.getId().equals("q1"));
        });

        scheduler.checkAll();

        List<ServiceInstance> healthy = registry.listHealthy("quotes");
        assertEquals(1, healthy.size());
        assertEquals("q1", healthy.get(0).getId());
        ServiceInstance q2 = registry.listInstances("quotes").stream()
                .filter(i -> i.getId().equals("q2")).findFirst().orElseThrow();
        assertEquals(1, q2.getConsecutiveFailedChecks());
    }
}
