package promptbatch.engine.repository;

import promptbatch.engine.model.Organization;
import promptbatch.engine.model.TrackedPrompt;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to organizations and their tracked prompts.
 * The catalog is maintained by the dashboard; the write methods exist for seeding.
 */
public interface PromptCatalog {

    List<Organization> findOrganizations();

    Optional<Organization> findOrganization(String orgId);

    /**
     * Active prompts of an organization, oldest first.
     */
    List<TrackedPrompt> findActivePrompts(String orgId);

    /**
     * Prompt texts by prompt id; ids with no prompt are absent from the map.
     */
    Map<String, String> findPromptTexts(Collection<String> promptIds);

    void saveOrganization(Organization organization);

    void savePrompt(TrackedPrompt prompt);

    boolean setPromptActive(String promptId, boolean active);
}
