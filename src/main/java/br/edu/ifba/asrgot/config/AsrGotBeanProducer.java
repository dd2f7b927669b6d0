package br.edu.ifba.asrgot.config;

import br.edu.ifba.asrgot.algorithms.GraphAlgorithms;
import br.edu.ifba.asrgot.algorithms.HyperedgeBuilder;
import br.edu.ifba.asrgot.algorithms.NodeSimilarityCalculator;
import br.edu.ifba.asrgot.algorithms.SimilarityWeights;
import br.edu.ifba.asrgot.confidence.ConfidenceModel;
import br.edu.ifba.asrgot.confidence.InformationTheory;
import br.edu.ifba.asrgot.extraction.HeuristicTextSignalExtractor;
import br.edu.ifba.asrgot.llm.ChunkedModelCallService;
import br.edu.ifba.asrgot.llm.ModelCallService;
import br.edu.ifba.asrgot.report.MarkdownReportExporter;
import br.edu.ifba.asrgot.scheduler.BoundedTaskScheduler;
import br.edu.ifba.asrgot.scheduler.TaskScheduler;
import br.edu.ifba.asrgot.stage.StageSettings;
import br.edu.ifba.asrgot.stage.StageToolkit;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

/**
 * CDI producer for the pipeline objects that are plain Java classes.
 *
 * <p>One {@link TaskScheduler} is shared by every research session. It wraps the model
 * service with prompt chunking and is closed on shutdown.</p>
 */
@ApplicationScoped
public class AsrGotBeanProducer {

    private static final Logger LOG = Logger.getLogger(AsrGotBeanProducer.class);

    @Inject
    AsrGotConfig config;

    @Inject
    ModelCallService modelCallService;

    @Produces
    @ApplicationScoped
    public TaskScheduler produceTaskScheduler() {
        AsrGotConfig.Scheduler scheduler = config.scheduler();
        LOG.infof("Creating task scheduler: maxConcurrent=%d, retention=%s, chunkTokenThreshold=%d",
            scheduler.maxConcurrent(), scheduler.retention(), config.model().chunkTokenThreshold());
        ModelCallService chunked = new ChunkedModelCallService(modelCallService, config.model().chunkTokenThreshold());
        return new BoundedTaskScheduler(chunked, scheduler.maxConcurrent(), scheduler.retention());
    }

    void closeTaskScheduler(@Disposes TaskScheduler scheduler) {
        LOG.info("Shutting down task scheduler");
        scheduler.close();
    }

    @Produces
    @Singleton
    public StageSettings produceStageSettings() {
        config.validate();
        return StageSettings.from(config);
    }

    @Produces
    @Singleton
    public StageToolkit produceStageToolkit() {
        AsrGotConfig.Similarity similarity = config.similarity();
        SimilarityWeights weights = new SimilarityWeights(
            similarity.weight().jaccard(),
            similarity.weight().containment(),
            similarity.weight().edit(),
            similarity.weight().abbreviation());
        LOG.debugf("Similarity threshold %.2f, weights %s", similarity.threshold(), weights);

        return new StageToolkit(
            new HeuristicTextSignalExtractor(),
            new ConfidenceModel(),
            new InformationTheory(),
            new GraphAlgorithms(new NodeSimilarityCalculator(weights), similarity.threshold()),
            new HyperedgeBuilder(),
            new MarkdownReportExporter()
        );
    }
}
