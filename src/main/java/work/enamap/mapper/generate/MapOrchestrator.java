package work.enamap.mapper.generate;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.enamap.mapper.catalog.ExternalServiceException;
import work.enamap.mapper.catalog.KernelCatalog;
import work.enamap.mapper.catalog.KernelWindow;
import work.enamap.mapper.catalog.ScienceCatalog;
import work.enamap.mapper.collect.NoInputsException;
import work.enamap.mapper.collect.TemporalFileCollector;
import work.enamap.mapper.dependency.DataLevel;
import work.enamap.mapper.dependency.DependencyResolver;
import work.enamap.mapper.descriptor.ConfigurationException;
import work.enamap.mapper.descriptor.DescriptorCodec;
import work.enamap.mapper.descriptor.MapDescriptor;
import work.enamap.mapper.engine.EngineContractViolationException;
import work.enamap.mapper.engine.EngineExecutionException;
import work.enamap.mapper.engine.EngineFactory;
import work.enamap.mapper.engine.EngineRequest;
import work.enamap.mapper.engine.InputType;
import work.enamap.mapper.engine.ProcessingEngine;
import work.enamap.mapper.engine.ProcessingInputs;
import work.enamap.mapper.period.TimeWindow;

/**
 * Builds a map and every map it depends on for one window.
 *
 * <p>Tier 2 maps are computed from pointing sets; tier 3 maps from the artifacts of their prerequisites (plus any
 * pointing sets the catalog holds). Kernels are selected once per call and reloaded into a cleared pool before each
 * engine invocation. Every engine must report exactly one artifact.</p>
 */
public final class MapOrchestrator implements MapGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(MapOrchestrator.class);

    private final GenerationContext context;
    private final TemporalFileCollector collector;
    private final ScienceCatalog scienceCatalog;
    private final KernelCatalog kernelCatalog;
    private final Path customKernel;

    public MapOrchestrator(
        GenerationContext context,
        TemporalFileCollector collector,
        ScienceCatalog scienceCatalog,
        KernelCatalog kernelCatalog,
        Path customKernel
    ) {
        this.context = Objects.requireNonNull(context, "context");
        this.collector = Objects.requireNonNull(collector, "collector");
        this.scienceCatalog = Objects.requireNonNull(scienceCatalog, "scienceCatalog");
        this.kernelCatalog = Objects.requireNonNull(kernelCatalog, "kernelCatalog");
        this.customKernel = customKernel;
    }

    @Override
    public Path generate(MapDescriptor descriptor, TimeWindow window) {
        if (DependencyResolver.tierOf(descriptor) == DataLevel.NOT_APPLICABLE) {
            throw new UnsupportedInstrumentException(DescriptorCodec.instrumentToken(descriptor));
        }
        GenerationPlan plan = GenerationPlan.of(descriptor);
        requireEngines(plan);

        List<Path> kernels = new ArrayList<>();
        for (KernelWindow kernel : collector.kernelWindows(window.start(), window.end())) {
            kernels.add(kernelCatalog.download(kernel));
        }

        Map<MapDescriptor, Path> artifacts = new HashMap<>();
        for (GenerationPlan.Step step : plan.steps()) {
            artifacts.put(step.descriptor(), build(step, window, kernels, artifacts));
        }
        return artifacts.get(descriptor);
    }

    private Path build(GenerationPlan.Step step, TimeWindow window, List<Path> kernels, Map<MapDescriptor, Path> artifacts) {
        MapDescriptor descriptor = step.descriptor();
        String mapDetails = descriptor + " " + window;

        List<String> pointingSets = collector.pointingInputs(descriptor, window);
        if (step.level() == DataLevel.L2 && pointingSets.isEmpty()) {
            throw new NoInputsException("No pointing sets found for " + mapDetails);
        }
        List<Path> mapInputs = new ArrayList<>();
        for (MapDescriptor dependency : step.dependencies()) {
            mapInputs.add(artifacts.get(dependency));
        }
        List<String> ancillary = collector.ancillaryInputs(descriptor, window.end());

        LOG.info("Generating map: {}", mapDetails);
        pointingSets.forEach(name -> LOG.info("  {}", name));
        mapInputs.forEach(path -> LOG.info("  {}", path.getFileName()));

        loadKernels(kernels);
        ProcessingInputs.Builder inputs = ProcessingInputs.builder()
            .add(InputType.SCIENCE, pointingSets);
        mapInputs.forEach(path -> inputs.add(InputType.SCIENCE, path.getFileName().toString()));
        inputs.add(InputType.ANCILLARY, ancillary);
        context.kernelPool().loaded().forEach(path -> inputs.add(InputType.SPICE, path.getFileName().toString()));

        List<Path> outputs = runEngine(step, window, inputs.build(), mapInputs);
        if (outputs.isEmpty()) {
            throw new EngineContractViolationException(
                step.level().upperToken() + " processing did not return any files! (" + mapDetails + ")", 0);
        }
        if (outputs.size() > 1) {
            throw new EngineContractViolationException(
                step.level().upperToken() + " processing returned too many files! (" + outputs.size() + ") (" + mapDetails + ")",
                outputs.size());
        }
        return outputs.get(0);
    }

    private void loadKernels(List<Path> kernels) {
        context.kernelPool().clear();
        kernels.forEach(context.kernelPool()::load);
        if (customKernel != null) {
            context.kernelPool().load(customKernel);
        }
    }

    private List<Path> runEngine(GenerationPlan.Step step, TimeWindow window, ProcessingInputs inputs, List<Path> mapInputs) {
        String pipeline = DescriptorCodec.encodePipeline(step.descriptor());
        EngineFactory factory = context.engines().get(step.descriptor().instrument(), step.level())
            .orElseThrow(() -> missingEngine(step));
        try (GenerationContext.Scope scratch = context.enterScratch(pipeline)) {
            EngineRequest request = new EngineRequest(
                step.descriptor(),
                step.level(),
                window,
                inputs,
                mapInputs,
                scratch.directory(),
                context.kernelPool(),
                context.layout(),
                scienceCatalog
            );
            return invoke(factory.create(request), pipeline);
        }
    }

    private static <D, R> List<Path> invoke(ProcessingEngine<D, R> engine, String pipeline) {
        try {
            D prepared = engine.prepareInputs();
            R results = engine.compute(prepared);
            List<Path> outputs = engine.finalizeOutputs(results, prepared);
            return outputs == null ? List.of() : outputs;
        } catch (ExternalServiceException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new EngineExecutionException(pipeline, ex);
        } catch (Exception ex) {
            throw new EngineExecutionException(pipeline, ex);
        } finally {
            engine.releaseResources();
        }
    }

    private void requireEngines(GenerationPlan plan) {
        for (GenerationPlan.Step step : plan.steps()) {
            if (!step.level().isProducible()) {
                throw new UnsupportedInstrumentException(DescriptorCodec.instrumentToken(step.descriptor()));
            }
            if (!context.engines().contains(step.descriptor().instrument(), step.level())) {
                throw missingEngine(step);
            }
        }
    }

    private static ConfigurationException missingEngine(GenerationPlan.Step step) {
        return new ConfigurationException(
            "No " + step.level().token() + " engine configured for " + step.descriptor().instrument().catalogName());
    }
}
