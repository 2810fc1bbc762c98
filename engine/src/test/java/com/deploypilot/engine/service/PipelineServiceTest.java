package com.deploypilot.engine.service;

import com.deploypilot.engine.definition.PipelineDefinitionParser;
import com.deploypilot.engine.model.Pipeline;
import com.deploypilot.engine.model.PipelineStatus;
import com.deploypilot.engine.model.PipelineVersion;
import com.deploypilot.engine.repository.PipelineRepository;
import com.deploypilot.engine.repository.PipelineVersionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineServiceTest {

    private static final String VALID = """
            pipelines:
              default:
                - step:
                    name: Build
                    script:
                      - make
            """;

    @Mock PipelineRepository        pipelineRepo;
    @Mock PipelineVersionRepository versionRepo;

    PipelineService service;

    @BeforeEach
    void setUp() {
        service = new PipelineService(pipelineRepo, versionRepo, new PipelineDefinitionParser());
    }

    // ------------------------------------------------------------------
    // create()
    // ------------------------------------------------------------------

    @Test
    void create_firstPipeline_isPlannedActiveVersionOne() {
        when(pipelineRepo.findByRepositoryKeyAndActiveTrue("acme/shop")).thenReturn(Optional.empty());
        when(pipelineRepo.save(any())).thenAnswer(inv -> withId(inv.getArgument(0)));

        Pipeline pipeline = service.create(newPipeline(VALID));

        assertThat(pipeline.getStatus()).isEqualTo(PipelineStatus.PLANNED);
        assertThat(pipeline.isActive()).isTrue();
        assertThat(pipeline.getVersion()).isEqualTo(1);
        assertThat(pipeline.getDefaultBranch()).isEqualTo("develop");
        assertThat(pipeline.getSourceUrl()).isEqualTo("https://example.com/acme/shop.git");

        ArgumentCaptor<PipelineVersion> version = ArgumentCaptor.forClass(PipelineVersion.class);
        verify(versionRepo).save(version.capture());
        assertThat(version.getValue().getVersion()).isEqualTo(1);
        assertThat(version.getValue().getDefinitionYaml()).isEqualTo(VALID);
    }

    @Test
    void create_existingActivePipeline_isDeactivatedFirst() {
        Pipeline previous = withId(new Pipeline("acme/shop", "acme", "shop", VALID));
        when(pipelineRepo.findByRepositoryKeyAndActiveTrue("acme/shop")).thenReturn(Optional.of(previous));
        when(pipelineRepo.save(any())).thenAnswer(inv -> withId(inv.getArgument(0)));

        Pipeline created = service.create(newPipeline(VALID));

        assertThat(previous.isActive()).isFalse();
        assertThat(created.isActive()).isTrue();
        InOrder order = inOrder(pipelineRepo);
        order.verify(pipelineRepo).saveAndFlush(previous);
        order.verify(pipelineRepo).save(created);
    }

    @Test
    void create_invalidDefinition_rejectedBeforeAnyWrite() {
        assertThatThrownBy(() -> service.create(newPipeline("pipelines: {}")))
                .isInstanceOfSatisfying(InvalidDefinitionException.class,
                        e -> assertThat(e.errors()).isNotEmpty());
        verifyNoInteractions(pipelineRepo, versionRepo);
    }

    // ------------------------------------------------------------------
    // regenerate()
    // ------------------------------------------------------------------

    @Test
    void regenerate_bumpsVersionAndResetsToPlanned() {
        Pipeline pipeline = withId(new Pipeline("acme/shop", "acme", "shop", VALID));
        pipeline.setStatus(PipelineStatus.FAILED);
        pipeline.setTestOutput("old output");
        when(pipelineRepo.findById(pipeline.getId())).thenReturn(Optional.of(pipeline));
        when(pipelineRepo.save(pipeline)).thenReturn(pipeline);
        String next = VALID.replace("make", "make test");

        Pipeline result = service.regenerate(pipeline.getId(), next);

        assertThat(result.getVersion()).isEqualTo(2);
        assertThat(result.getStatus()).isEqualTo(PipelineStatus.PLANNED);
        assertThat(result.getDefinitionYaml()).isEqualTo(next);
        assertThat(result.getTestOutput()).isNull();
        assertThat(result.getId()).isEqualTo(pipeline.getId());
        verify(versionRepo).save(any(PipelineVersion.class));
    }

    @Test
    void regenerate_unknownPipeline_throwsNotFound() {
        UUID missing = UUID.randomUUID();
        when(pipelineRepo.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.regenerate(missing, VALID))
                .isInstanceOf(PipelineNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // updateDeployment()
    // ------------------------------------------------------------------

    @Test
    void updateDeployment_onlyNonNullFieldsChange() {
        Pipeline pipeline = withId(new Pipeline("acme/shop", "acme", "shop", VALID));
        pipeline.setSourceUrl("/srv/shop");
        when(pipelineRepo.findById(pipeline.getId())).thenReturn(Optional.of(pipeline));
        when(pipelineRepo.save(pipeline)).thenReturn(pipeline);

        service.updateDeployment(pipeline.getId(), new DeploymentUpdate("prod-1.internal", " ", null));

        assertThat(pipeline.getDeploymentServer()).isEqualTo("prod-1.internal");
        assertThat(pipeline.getDefaultBranch()).isEqualTo("main");
        assertThat(pipeline.getSourceUrl()).isEqualTo("/srv/shop");
    }

    // ------------------------------------------------------------------
    // Test object factories
    // ------------------------------------------------------------------

    private static NewPipeline newPipeline(String yaml) {
        return new NewPipeline("acme/shop", "acme", "shop",
                "https://example.com/acme/shop.git", "develop", null, yaml);
    }

    private static <T> T withId(T entity) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            if (f.get(entity) == null) f.set(entity, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return entity;
    }
}
