package tech.entragov.sdk.client.resources;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.entragov.sdk.client.GraphTestServer;
import tech.entragov.sdk.dto.Policy;
import tech.entragov.sdk.enums.GrantOperator;
import tech.entragov.sdk.enums.PolicyState;

import java.time.Instant;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;

class PoliciesTest {

    private static final String POLICIES = "/v1.0/identity/conditionalAccess/policies";

    private GraphTestServer graph;
    private WireMockServer server;
    private Policies policies;

    @BeforeEach
    void setUp() {
        graph = new GraphTestServer().start();
        server = graph.server();
        policies = graph.client().policies();
    }

    @AfterEach
    void tearDown() {
        graph.stop();
    }

    @Test
    void shouldMapConditionsGrantAndSessionControls() {
        // Given
        server.stubFor(get(urlPathEqualTo(POLICIES)).willReturn(okJson("""
            {"value":[{
              "id":"p1",
              "displayName":"Require MFA for admins",
              "state":"enabled",
              "modifiedDateTime":"2024-05-01T08:30:00Z",
              "conditions":{
                "clientAppTypes":["all"],
                "users":{"includeUsers":[],"excludeUsers":["breakglass"],
                         "includeGroups":[],"excludeGroups":[],
                         "includeRoles":["62e90394-69f5-4237-9190-012177145e10"],"excludeRoles":[]},
                "applications":{"includeApplications":["All"],"excludeApplications":[]},
                "locations":{"includeLocations":["All"],"excludeLocations":["AllTrusted"]}
              },
              "grantControls":{"operator":"AND","builtInControls":["mfa","compliantDevice"],
                               "authenticationStrength":{"id":"00000000-0000-0000-0000-000000000002"}},
              "sessionControls":{
                "signInFrequency":{"value":4,"type":"hours","isEnabled":true},
                "persistentBrowser":{"mode":"never","isEnabled":false},
                "disableResilienceDefaults":true
              }
            }]}""")));

        // When
        List<Policy> result = policies.list();

        // Then
        assertThat(result).hasSize(1);
        Policy policy = result.get(0);
        assertThat(policy.state()).isEqualTo(PolicyState.ENABLED);
        assertThat(policy.modifiedAt()).isEqualTo(Instant.parse("2024-05-01T08:30:00Z"));
        assertThat(policy.conditions().users().excludeUsers()).containsExactly("breakglass");
        assertThat(policy.conditions().users().includeRoles()).hasSize(1);
        assertThat(policy.conditions().applications().includesAll()).isTrue();
        assertThat(policy.conditions().hasLocationConditions()).isTrue();
        assertThat(policy.grantControls().operator()).isEqualTo(GrantOperator.AND);
        assertThat(policy.grantControls().requiresMfa()).isTrue();
        assertThat(policy.grantControls().requirements())
            .contains("mfa", "compliantDevice", "authenticationStrength:00000000-0000-0000-0000-000000000002");
        assertThat(policy.sessionControls()).containsExactlyInAnyOrder("signInFrequency", "disableResilienceDefaults");
    }

    @Test
    void shouldMapReportOnlyPolicyWithoutControls() {
        server.stubFor(get(urlPathEqualTo(POLICIES)).willReturn(okJson("""
            {"value":[{"id":"p2","displayName":"Pilot","state":"enabledForReportingButNotEnforced",
                       "conditions":{"users":{"includeUsers":["All"]}},
                       "grantControls":null,"sessionControls":null}]}""")));

        Policy policy = policies.list().get(0);

        assertThat(policy.state()).isEqualTo(PolicyState.REPORT_ONLY);
        assertThat(policy.isEnabled()).isFalse();
        assertThat(policy.conditions().users().includesAll()).isTrue();
        assertThat(policy.grantControls().builtInControls()).isEmpty();
        assertThat(policy.hasSessionControls()).isFalse();
    }

    @Test
    void shouldGetSinglePolicy() {
        server.stubFor(get(urlPathEqualTo(POLICIES + "/p3")).willReturn(okJson("""
            {"id":"p3","displayName":"Block legacy","state":"disabled",
             "conditions":{"clientAppTypes":["exchangeActiveSync","other"]},
             "grantControls":{"operator":"OR","builtInControls":["block"]}}""")));

        Policy policy = policies.get("p3");

        assertThat(policy.state()).isEqualTo(PolicyState.DISABLED);
        assertThat(policy.grantControls().blocks()).isTrue();
        assertThat(policy.conditions().targetsLegacyClients()).isTrue();
    }
}
