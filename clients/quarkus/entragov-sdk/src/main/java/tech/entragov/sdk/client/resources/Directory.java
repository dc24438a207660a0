package tech.entragov.sdk.client.resources;

import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;
import tech.entragov.sdk.client.GraphClient;
import tech.entragov.sdk.dto.DirectoryUser;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static tech.entragov.sdk.support.GraphJson.text;

/**
 * Resource for the tenant inventory that policy coverage is measured against.
 */
public class Directory {

    private static final Logger LOG = Logger.getLogger(Directory.class);

    private final GraphClient client;

    public Directory(GraphClient client) {
        this.client = client;
    }

    /**
     * Every user with the ids of the groups it is a direct member of.
     */
    public List<DirectoryUser> users() {
        List<DirectoryUser> users = client
            .getAllPages("users", Map.of("$select", "id", "$expand", "memberOf($select=id)"))
            .map(this::mapUser)
            .toList();
        LOG.infof("Fetched %d directory users", users.size());
        return users;
    }

    /**
     * App ids of every service principal, the identifiers Conditional Access targets.
     */
    public Set<String> applicationIds() {
        Set<String> appIds = new LinkedHashSet<>();
        client.getAllPages("servicePrincipals", Map.of("$select", "appId"))
            .map(data -> text(data, "appId"))
            .forEach(appId -> {
                if (appId != null) {
                    appIds.add(appId);
                }
            });
        LOG.infof("Fetched %d application ids", appIds.size());
        return Set.copyOf(appIds);
    }

    private DirectoryUser mapUser(JsonNode data) {
        Set<String> groupIds = new LinkedHashSet<>();
        for (JsonNode membership : data.path("memberOf")) {
            String type = text(membership, "@odata.type");
            if (type == null || type.endsWith(".group")) {
                groupIds.add(text(membership, "id"));
            }
        }
        groupIds.removeIf(Objects::isNull);
        return new DirectoryUser(text(data, "id"), Set.copyOf(groupIds));
    }
}
