package org.crmjobs.stats;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphQlStatsFetcherTest {

    private StubGraphQlServer server;
    private GraphQlStatsFetcher fetcher;

    @BeforeEach
    void setUp() {
        server = new StubGraphQlServer();
        fetcher = new GraphQlStatsFetcher(new GraphQlClient(server.url(), Duration.ofSeconds(5)));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("counts customers and orders and sums order amounts")
    void sumsRevenue() throws Exception {
        server.respond(200, """
                {"data":{
                  "customers":[{"id":"1"},{"id":"2"}],
                  "orders":[{"id":"1","totalAmount":"100.10"},{"id":"2","totalAmount":200.2},{"id":"3","totalAmount":null}]
                }}
                """);

        CrmStats stats = fetcher.getStats();

        assertThat(stats.customerCount()).isEqualTo(2);
        assertThat(stats.orderCount()).isEqualTo(3);
        assertThat(stats.totalRevenue()).isEqualByComparingTo(new BigDecimal("300.30"));
        assertThat(server.lastRequest()).contains("customers").contains("totalAmount");
    }

    @Test
    void emptyCrm() throws Exception {
        server.respond(200, "{\"data\":{\"customers\":[],\"orders\":[]}}");

        CrmStats stats = fetcher.getStats();

        assertThat(stats.customerCount()).isZero();
        assertThat(stats.orderCount()).isZero();
        assertThat(stats.totalRevenue()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("GraphQL errors fail the fetch with the first error message")
    void graphQlErrors() {
        server.respond(200, "{\"errors\":[{\"message\":\"Cannot query field\"}]}");

        assertThatThrownBy(() -> fetcher.getStats())
                .isInstanceOf(FetchException.class)
                .hasMessage("GraphQL error: Cannot query field");
    }

    @Test
    void nonNumericAmountFails() {
        server.respond(200, "{\"data\":{\"customers\":[],\"orders\":[{\"id\":\"1\",\"totalAmount\":\"abc\"}]}}");

        assertThatThrownBy(() -> fetcher.getStats()).isInstanceOf(FetchException.class);
    }

    @Test
    void httpErrorFails() {
        server.respond(500, "oops");

        assertThatThrownBy(() -> fetcher.getStats())
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void unreachableEndpointFails() {
        String url = server.url();
        server.close();
        GraphQlStatsFetcher unreachable = new GraphQlStatsFetcher(new GraphQlClient(url, Duration.ofSeconds(2)));

        assertThatThrownBy(unreachable::getStats).isInstanceOf(FetchException.class);
    }
}
