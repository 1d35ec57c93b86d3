package promptbatch.engine.store;

import promptbatch.engine.model.Organization;
import promptbatch.engine.model.SubscriptionTier;
import promptbatch.engine.model.TrackedPrompt;
import promptbatch.engine.repository.PromptCatalog;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of PromptCatalog.
 * Pinned providers are stored as a comma-separated list.
 */
public class JdbcPromptCatalog implements PromptCatalog {

    private final Database db;

    public JdbcPromptCatalog(Database db) {
        this.db = db;
    }

    @Override
    public List<Organization> findOrganizations() {
        String sql = "SELECT * FROM organizations ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<Organization> result = new ArrayList<>();
            while (rs.next()) {
                result.add(mapOrganization(rs));
            }
            return result;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list organizations", e);
        }
    }

    @Override
    public Optional<Organization> findOrganization(String orgId) {
        String sql = "SELECT * FROM organizations WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, orgId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapOrganization(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find organization: " + orgId, e);
        }
    }

    @Override
    public List<TrackedPrompt> findActivePrompts(String orgId) {
        String sql = "SELECT * FROM prompts WHERE org_id = ? AND active = TRUE ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, orgId);
            List<TrackedPrompt> result = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapPrompt(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find prompts for org: " + orgId, e);
        }
    }

    @Override
    public Map<String, String> findPromptTexts(Collection<String> promptIds) {
        Map<String, String> texts = new HashMap<>();
        if (promptIds.isEmpty())
            return texts;

        String sql = "SELECT id, text FROM prompts WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (String id : promptIds) {
                ps.setString(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        texts.put(rs.getString("id"), rs.getString("text"));
                    }
                }
            }
            return texts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load prompt texts", e);
        }
    }

    @Override
    public void saveOrganization(Organization organization) {
        String sql = """
                    MERGE INTO organizations (id, name, tier, subscribed, trial_expires_at, providers)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, organization.id());
            ps.setString(2, organization.name());
            ps.setString(3, organization.tier().name());
            ps.setBoolean(4, organization.subscribed());
            setTimestamp(ps, 5, organization.trialExpiresAt());
            ps.setString(6, organization.pinnedProviders().isEmpty()
                    ? null
                    : String.join(",", organization.pinnedProviders()));
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save organization: " + organization.id(), e);
        }
    }

    @Override
    public void savePrompt(TrackedPrompt prompt) {
        String sql = """
                    MERGE INTO prompts (id, org_id, text, active, created_at)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, prompt.id());
            ps.setString(2, prompt.orgId());
            ps.setString(3, prompt.text());
            ps.setBoolean(4, prompt.active());
            ps.setTimestamp(5, Timestamp.from(Objects.requireNonNull(prompt.createdAt(), "createdAt is required")));
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save prompt: " + prompt.id(), e);
        }
    }

    @Override
    public boolean setPromptActive(String promptId, boolean active) {
        String sql = "UPDATE prompts SET active = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, active);
            ps.setString(2, promptId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update prompt: " + promptId, e);
        }
    }

    private static Organization mapOrganization(ResultSet rs) throws SQLException {
        String providers = rs.getString("providers");
        List<String> pinned = providers == null || providers.isBlank()
                ? List.of()
                : Arrays.stream(providers.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        Timestamp trial = rs.getTimestamp("trial_expires_at");
        return new Organization(
                rs.getString("id"),
                rs.getString("name"),
                SubscriptionTier.fromName(rs.getString("tier")),
                rs.getBoolean("subscribed"),
                trial != null ? trial.toInstant() : null,
                pinned);
    }

    private static TrackedPrompt mapPrompt(ResultSet rs) throws SQLException {
        Timestamp created = rs.getTimestamp("created_at");
        return new TrackedPrompt(
                rs.getString("id"),
                rs.getString("org_id"),
                rs.getString("text"),
                rs.getBoolean("active"),
                created != null ? created.toInstant() : null);
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
