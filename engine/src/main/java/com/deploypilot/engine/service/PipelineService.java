package com.deploypilot.engine.service;

import com.deploypilot.engine.definition.DefinitionParseResult;
import com.deploypilot.engine.definition.PipelineDefinition;
import com.deploypilot.engine.definition.PipelineDefinitionParser;
import com.deploypilot.engine.model.Pipeline;
import com.deploypilot.engine.model.PipelineVersion;
import com.deploypilot.engine.repository.PipelineRepository;
import com.deploypilot.engine.repository.PipelineVersionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Pipeline lifecycle: creation as the repository's single active pipeline,
 * regeneration into a new immutable version, deployment parameter edits.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final PipelineRepository        pipelineRepo;
    private final PipelineVersionRepository versionRepo;
    private final PipelineDefinitionParser  parser;

    public PipelineService(PipelineRepository pipelineRepo,
                           PipelineVersionRepository versionRepo,
                           PipelineDefinitionParser parser) {
        this.pipelineRepo = pipelineRepo;
        this.versionRepo  = versionRepo;
        this.parser       = parser;
    }

    // ------------------------------------------------------------------
    // Creation / regeneration
    // ------------------------------------------------------------------

    /**
     * Create a PLANNED pipeline and make it the repository's active one.
     *
     * The previously active pipeline (if any) is deactivated and flushed
     * first, so the partial unique index on (repository_key) WHERE active
     * never sees two active rows.
     */
    @Transactional
    public Pipeline create(NewPipeline request) {
        requireValid(request.definitionYaml());

        pipelineRepo.findByRepositoryKeyAndActiveTrue(request.repositoryKey()).ifPresent(previous -> {
            previous.setActive(false);
            pipelineRepo.saveAndFlush(previous);
            log.info("Pipeline {} superseded as active pipeline of repository {}",
                    previous.getId(), request.repositoryKey());
        });

        Pipeline pipeline = new Pipeline(request.repositoryKey(), request.remoteWorkspace(),
                request.remoteRepoSlug(), request.definitionYaml());
        pipeline.setSourceUrl(request.sourceUrl());
        pipeline.setDeploymentServer(request.deploymentServer());
        if (request.defaultBranch() != null && !request.defaultBranch().isBlank()) {
            pipeline.setDefaultBranch(request.defaultBranch());
        }
        pipeline = pipelineRepo.save(pipeline);
        versionRepo.save(new PipelineVersion(pipeline.getId(), pipeline.getVersion(), request.definitionYaml()));

        log.info("Pipeline {} created for repository {}", pipeline.getId(), request.repositoryKey());
        return pipeline;
    }

    /**
     * Replace the definition with a new version. Identity, activity and run
     * history stay; status goes back to PLANNED.
     */
    @Transactional
    public Pipeline regenerate(UUID pipelineId, String definitionYaml) {
        requireValid(definitionYaml);
        Pipeline pipeline = get(pipelineId);
        pipeline.nextVersion(definitionYaml);
        pipeline.setErrorMessage(null);
        pipeline.setTestOutput(null);
        versionRepo.save(new PipelineVersion(pipeline.getId(), pipeline.getVersion(), definitionYaml));
        log.info("Pipeline {} regenerated as version {}", pipelineId, pipeline.getVersion());
        return pipelineRepo.save(pipeline);
    }

    @Transactional
    public Pipeline updateDeployment(UUID pipelineId, DeploymentUpdate update) {
        Pipeline pipeline = get(pipelineId);
        if (update.deploymentServer() != null) pipeline.setDeploymentServer(update.deploymentServer());
        if (update.defaultBranch() != null && !update.defaultBranch().isBlank()) {
            pipeline.setDefaultBranch(update.defaultBranch());
        }
        if (update.sourceUrl() != null) pipeline.setSourceUrl(update.sourceUrl());
        return pipelineRepo.save(pipeline);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Pipeline get(UUID pipelineId) {
        return pipelineRepo.findById(pipelineId)
                .orElseThrow(() -> new PipelineNotFoundException(pipelineId));
    }

    @Transactional(readOnly = true)
    public List<PipelineVersion> versions(UUID pipelineId) {
        get(pipelineId);
        return versionRepo.findByPipelineIdOrderByVersionDesc(pipelineId);
    }

    /** Parsed current definition of a pipeline. */
    public PipelineDefinition definitionOf(Pipeline pipeline) {
        return requireValid(pipeline.getDefinitionYaml());
    }

    private PipelineDefinition requireValid(String yaml) {
        DefinitionParseResult parsed = parser.parse(yaml);
        if (!parsed.isValid()) {
            throw new InvalidDefinitionException(parsed.errors());
        }
        return parsed.definition();
    }
}
