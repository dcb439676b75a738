package com.docflow.engine.persistence;

import com.docflow.core.exception.DuplicateDefinitionException;
import com.docflow.core.exception.NotFoundException;
import com.docflow.core.model.SemanticVersion;
import com.docflow.core.model.WorkflowDefinition;
import com.docflow.core.test.SampleDefinitions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class InMemoryWorkflowDefinitionRepositoryTest {

    private final InMemoryWorkflowDefinitionRepository repository = new InMemoryWorkflowDefinitionRepository();

    @Test
    @DisplayName("Same name and version cannot be saved twice")
    void save_shouldRejectDuplicateVersion() {
        WorkflowDefinition v1 = SampleDefinitions.reviewWorkflow();
        repository.save(v1);

        WorkflowDefinition copy = new WorkflowDefinition.Builder(v1).id("other-id").build();

        assertThatThrownBy(() -> repository.save(copy)).isInstanceOf(DuplicateDefinitionException.class);
        assertThat(repository.findById("other-id")).isEmpty();
    }

    @Test
    @DisplayName("Latest is the highest active semantic version")
    void findLatest_shouldPickHighestActiveVersion() {
        WorkflowDefinition v1 = SampleDefinitions.reviewWorkflow();
        WorkflowDefinition v2 = v1.revise().build();
        WorkflowDefinition v10 = v1.revise().version("1.10.0").build();
        repository.save(v1);
        repository.save(v2);
        repository.save(v10);

        assertThat(repository.findLatest("document-review")).contains(v10);

        repository.deactivate(v10.id());

        assertThat(repository.findLatest("document-review")).contains(v2);
        assertThat(repository.listVersions("document-review"))
            .extracting(WorkflowDefinition::version)
            .containsExactly(SemanticVersion.parse("1.10.0"), v2.version(), v1.version());
        assertThat(repository.listLatest()).singleElement()
            .satisfies(d -> assertThat(d.version()).isEqualTo(SemanticVersion.parse("1.10.0")));
    }

    @Test
    @DisplayName("Lookup by name and version")
    void find_shouldUseNameAndVersion() {
        WorkflowDefinition v1 = SampleDefinitions.reviewWorkflow();
        repository.save(v1);

        assertThat(repository.find("document-review", v1.version())).contains(v1);
        assertThat(repository.find("document-review", SemanticVersion.parse("9.0.0"))).isEmpty();
    }

    @Test
    @DisplayName("Deactivating an unknown definition fails")
    void deactivate_shouldRejectUnknownId() {
        assertThatThrownBy(() -> repository.deactivate("missing")).isInstanceOf(NotFoundException.class);
    }
}
