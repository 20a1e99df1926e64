/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.projection;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import io.kroxylicious.routeplane.api.HeaderValue;
import io.kroxylicious.routeplane.api.HeadersPolicySpec;
import io.kroxylicious.routeplane.api.InMemoryEntitySnapshot;
import io.kroxylicious.routeplane.api.ResourceId;
import io.kroxylicious.routeplane.api.RouteSpec;
import io.kroxylicious.routeplane.api.ServiceSpec;
import io.kroxylicious.routeplane.api.TlsSpec;
import io.kroxylicious.routeplane.dag.BuilderOptions;
import io.kroxylicious.routeplane.dag.Cluster;
import io.kroxylicious.routeplane.dag.Dag;
import io.kroxylicious.routeplane.dag.DagBuilder;
import io.kroxylicious.routeplane.dag.HeaderCondition;
import io.kroxylicious.routeplane.dag.Route;
import io.kroxylicious.routeplane.dag.Service;
import io.kroxylicious.routeplane.dag.TimeoutPolicy;
import io.kroxylicious.routeplane.dag.TlsVersion;
import io.kroxylicious.routeplane.xds.ClusterWeight;
import io.kroxylicious.routeplane.xds.ForwardAction;
import io.kroxylicious.routeplane.xds.HeaderMatcher;
import io.kroxylicious.routeplane.xds.HeaderValueOption;
import io.kroxylicious.routeplane.xds.RedirectAction;
import io.kroxylicious.routeplane.xds.RouteConfiguration;
import io.kroxylicious.routeplane.xds.RouteEntry;
import io.kroxylicious.routeplane.xds.WeightedClusters;

import static io.kroxylicious.routeplane.Fixtures.root;
import static io.kroxylicious.routeplane.Fixtures.secureRoot;
import static io.kroxylicious.routeplane.Fixtures.service;
import static io.kroxylicious.routeplane.Fixtures.servingSecret;
import static org.assertj.core.api.Assertions.assertThat;

class RouteVisitorTest {

    private static final String KUARD_CLUSTER = "roots/kuard/8080/da39a3ee5e";
    private static final HeaderValueOption REQUEST_START = new HeaderValueOption(RouteVisitor.REQUEST_START_HEADER, RouteVisitor.REQUEST_START_VALUE, true);

    private final RouteVisitor visitor = new RouteVisitor(8080, 8443);

    private static Cluster cluster(String name, int weight) {
        Service service = new Service(ResourceId.of("roots", name), 80, "http", "", Service.CircuitBreakers.NONE);
        return new Cluster(service, weight, null, null, null, "", null);
    }

    private static Route route(String prefix, List<HeaderCondition> conditions, Cluster... clusters) {
        return new Route(prefix, conditions, List.of(clusters), false, false, null, null, null, null, null, List.of(), null, null, null);
    }

    private static HeaderCondition exact(String name, String value) {
        return new HeaderCondition(name, HeaderCondition.MatchType.EXACT, value, false);
    }

    private static Dag dag(RouteSpec... routes) {
        return new DagBuilder(BuilderOptions.defaults()).build(InMemoryEntitySnapshot.builder()
                .addIngressRoutes(root("roots", "example", "example.com", routes))
                .addServices(service("roots", "kuard", 8080), service("roots", "other", 8080))
                .build()).dag();
    }

    private static ForwardAction forward(RouteEntry entry) {
        assertThat(entry.action()).isInstanceOf(ForwardAction.class);
        return (ForwardAction) entry.action();
    }

    @Test
    void emptyGraphStillHasHttpAndHttpsConfigurations() {
        // given
        Dag dag = Dag.empty();

        // when
        Map<String, RouteConfiguration> configurations = visitor.visit(dag);

        // then
        assertThat(configurations).containsOnlyKeys(ListenerVisitor.HTTP_LISTENER, ListenerVisitor.HTTPS_LISTENER);
        assertThat(configurations.values()).allSatisfy(c -> assertThat(c.virtualHosts()).isEmpty());
    }

    @Test
    void routesOrderedByPrefixThenHeaderConditions() {
        // given
        Cluster c = cluster("kuard", 0);
        Route slash = route("/", List.of(), c);
        Route foo = route("/foo", List.of(), c);
        Route fooBar = route("/foo/bar", List.of(), c);
        Route headerFoo = route("/", List.of(exact("x-header", "foo")), c);
        Route headerBar = route("/", List.of(exact("x-header", "bar")), c);
        Route twoHeaders = route("/", List.of(exact("x-a", "1"), exact("x-b", "2")), c);

        // when
        List<Route> sorted = RouteVisitor.sorted(List.of(slash, headerFoo, foo, twoHeaders, fooBar, headerBar));

        // then
        assertThat(sorted).containsExactly(fooBar, foo, twoHeaders, headerBar, headerFoo, slash);
    }

    @Test
    void routesComparingEqualKeepInsertionOrder() {
        // given
        Route first = route("/", List.of(), cluster("first", 0));
        Route second = route("/", List.of(), cluster("second", 0));

        // when
        List<Route> sorted = RouteVisitor.sorted(List.of(first, second));

        // then
        assertThat(sorted).containsExactly(first, second);
    }

    @Test
    void plainHostForwardsWithRequestStartHeader() {
        // given
        Dag dag = dag(RouteSpec.toServices("/", ServiceSpec.of("kuard", 8080)));

        // when
        Map<String, RouteConfiguration> configurations = visitor.visit(dag);

        // then
        assertThat(configurations.get(ListenerVisitor.HTTP_LISTENER).virtualHosts()).singleElement().satisfies(vh -> {
            assertThat(vh.name()).isEqualTo("example.com");
            assertThat(vh.domains()).containsExactly("example.com", "example.com:8080");
            assertThat(vh.routes()).singleElement().satisfies(entry -> {
                assertThat(entry.match().prefix()).isEqualTo("/");
                assertThat(entry.requestHeadersToAdd()).containsExactly(REQUEST_START);
                assertThat(forward(entry).cluster()).isEqualTo(KUARD_CLUSTER);
                assertThat(forward(entry).weightedClusters()).isNull();
            });
        });
        assertThat(configurations.get(ListenerVisitor.HTTPS_LISTENER).virtualHosts()).isEmpty();
    }

    @Test
    void secureHostRedirectsPlainTextToHttps() {
        // given
        Dag dag = new DagBuilder(BuilderOptions.defaults()).build(InMemoryEntitySnapshot.builder()
                .addIngressRoutes(secureRoot("roots", "example", "example.com", TlsSpec.withSecret("cert"),
                        RouteSpec.toServices("/", ServiceSpec.of("kuard", 8080))))
                .addServices(service("roots", "kuard", 8080))
                .addSecrets(servingSecret("roots", "cert"))
                .build()).dag();

        // when
        Map<String, RouteConfiguration> configurations = visitor.visit(dag);

        // then
        assertThat(configurations.get(ListenerVisitor.HTTP_LISTENER).virtualHosts()).singleElement()
                .satisfies(vh -> assertThat(vh.routes()).singleElement()
                        .satisfies(entry -> assertThat(entry.action()).isEqualTo(RedirectAction.HTTPS)));
        assertThat(configurations.get(ListenerVisitor.HTTPS_LISTENER).virtualHosts()).singleElement().satisfies(vh -> {
            assertThat(vh.domains()).containsExactly("example.com", "example.com:8443");
            assertThat(vh.routes()).singleElement()
                    .satisfies(entry -> assertThat(forward(entry).cluster()).isEqualTo(KUARD_CLUSTER));
        });
        assertThat(configurations).doesNotContainKey(ListenerVisitor.FALLBACK_ROUTE_CONFIG);
    }

    @Test
    void fallbackHostsGetTheirOwnConfiguration() {
        // given
        BuilderOptions options = new BuilderOptions(TlsVersion.TLS_1_1, ResourceId.of("roots", "fallback"), List.of(), false);
        Dag dag = new DagBuilder(options).build(InMemoryEntitySnapshot.builder()
                .addIngressRoutes(secureRoot("roots", "a", "a.example.com", new TlsSpec("cert", null, null, false, true, null),
                        RouteSpec.toServices("/", ServiceSpec.of("kuard", 8080))),
                        secureRoot("roots", "b", "b.example.com", TlsSpec.withSecret("cert"),
                                RouteSpec.toServices("/", ServiceSpec.of("kuard", 8080))))
                .addServices(service("roots", "kuard", 8080))
                .addSecrets(servingSecret("roots", "cert"), servingSecret("roots", "fallback"))
                .build()).dag();

        // when
        Map<String, RouteConfiguration> configurations = visitor.visit(dag);

        // then
        assertThat(configurations.get(ListenerVisitor.HTTPS_LISTENER).virtualHosts()).hasSize(2);
        assertThat(configurations.get(ListenerVisitor.FALLBACK_ROUTE_CONFIG).virtualHosts())
                .singleElement()
                .satisfies(vh -> assertThat(vh.name()).isEqualTo("a.example.com"));
    }

    @Test
    void headersPolicyFollowsRequestStartHeader() {
        // given
        RouteSpec spec = new RouteSpec("/", List.of(ServiceSpec.of("kuard", 8080)), null, false, false, null, null, null, null, null, null, null, null,
                new HeadersPolicySpec(List.of(new HeaderValue("x-foo", "bar"), new HeaderValue("host", "internal.example.com")), List.of("x-remove-me")),
                new HeadersPolicySpec(List.of(new HeaderValue("x-served-by", "routeplane")), List.of()));

        // when
        Map<String, RouteConfiguration> configurations = visitor.visit(dag(spec));

        // then
        RouteEntry entry = configurations.get(ListenerVisitor.HTTP_LISTENER).virtualHosts().get(0).routes().get(0);
        assertThat(entry.requestHeadersToAdd()).containsExactly(REQUEST_START, new HeaderValueOption("X-Foo", "bar", false));
        assertThat(entry.requestHeadersToRemove()).containsExactly("X-Remove-Me");
        assertThat(entry.hostRewrite()).isEqualTo("internal.example.com");
        assertThat(entry.responseHeadersToAdd()).containsExactly(new HeaderValueOption("X-Served-By", "routeplane", false));
    }

    @Test
    void multipleClustersAreWeighted() {
        // given
        Dag dag = dag(RouteSpec.toServices("/", ServiceSpec.weighted("other", 8080, 10), ServiceSpec.weighted("kuard", 8080, 90)));

        // when
        RouteEntry entry = visitor.visit(dag).get(ListenerVisitor.HTTP_LISTENER).virtualHosts().get(0).routes().get(0);

        // then
        assertThat(entry.requestHeadersToAdd()).isEmpty();
        assertThat(forward(entry).cluster()).isNull();
        WeightedClusters weighted = forward(entry).weightedClusters();
        assertThat(weighted.totalWeight()).isEqualTo(100);
        assertThat(weighted.clusters())
                .containsExactly(new ClusterWeight(KUARD_CLUSTER, 90, List.of(REQUEST_START)),
                        new ClusterWeight("roots/other/8080/da39a3ee5e", 10, List.of(REQUEST_START)));
    }

    @Test
    void unweightedClustersSplitEvenly() {
        // when
        WeightedClusters weighted = RouteVisitor.weightedClusters(List.of(cluster("a", 0), cluster("b", 0), cluster("c", 0)));

        // then
        assertThat(weighted.totalWeight()).isEqualTo(3);
        assertThat(weighted.clusters()).extracting(ClusterWeight::weight).containsExactly(1, 1, 1);
    }

    @Test
    void zeroWeightAmongWeightedClustersGetsNoTraffic() {
        // when
        WeightedClusters weighted = RouteVisitor.weightedClusters(List.of(cluster("a", 0), cluster("b", 50)));

        // then
        assertThat(weighted.totalWeight()).isEqualTo(50);
        assertThat(weighted.clusters()).extracting(ClusterWeight::weight).containsExactly(0, 50);
    }

    @Test
    void mixedWeightsAreProjectedUnchanged() {
        // when
        WeightedClusters weighted = RouteVisitor.weightedClusters(List.of(cluster("c", 3), cluster("a", 2), cluster("b", 0)));

        // then
        assertThat(weighted.totalWeight()).isEqualTo(5);
        assertThat(weighted.clusters()).extracting(ClusterWeight::weight).containsExactly(2, 0, 3);
    }

    @Test
    void containsConditionBecomesEscapedRegex() {
        // given
        Route contains = route("/", List.of(new HeaderCondition("x-version", HeaderCondition.MatchType.CONTAINS, "1.2", true)), cluster("kuard", 0));

        // when
        List<HeaderMatcher> headers = RouteVisitor.match(contains).headers();

        // then
        assertThat(headers).containsExactly(HeaderMatcher.safeRegex("x-version", ".*1\\.2.*", true));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "plain|plain",
            "a.b|a\\.b",
            "(x)|\\(x\\)",
            "1+1*2?|1\\+1\\*2\\?",
            "[a]{2}^$|\\[a\\]\\{2\\}\\^\\$"
    })
    void quoteMeta(String input, String expected) {
        assertThat(RouteVisitor.quoteMeta(input)).isEqualTo(expected);
    }

    @Test
    void routeTimeoutTakesPrecedenceOverTimeoutPolicy() {
        // given
        Route route = new Route("/", List.of(), List.of(cluster("kuard", 0)), true, false, "/api", new TimeoutPolicy(Duration.ofSeconds(30)),
                Duration.ofSeconds(5), Duration.ofSeconds(10), null, List.of(), null, null, null);
        Route policyOnly = new Route("/", List.of(), List.of(cluster("kuard", 0)), false, false, null, new TimeoutPolicy(Duration.ofSeconds(30)),
                null, null, null, List.of(), null, null, null);

        // when
        ForwardAction withTimeout = forward(RouteVisitor.secureRoute(route));
        ForwardAction withPolicy = forward(RouteVisitor.secureRoute(policyOnly));

        // then
        assertThat(withTimeout.timeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(withTimeout.idleTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(withTimeout.prefixRewrite()).isEqualTo("/api");
        assertThat(withTimeout.upgradeConfigs()).containsExactly(RouteVisitor.WEBSOCKET_UPGRADE);
        assertThat(withPolicy.timeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(withPolicy.upgradeConfigs()).isEmpty();
    }
}
