package work.lcod.converter.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.converter.analysis.WorkflowAnalysis;
import work.lcod.converter.analysis.WorkflowAnalyzer;
import work.lcod.converter.document.DocumentLoader;
import work.lcod.converter.document.LoadResult;
import work.lcod.converter.document.WorkflowFormatException;
import work.lcod.converter.emit.CodeEmitter;
import work.lcod.converter.emit.GeneratorRegistry;
import work.lcod.converter.graph.ExecutionOrder;
import work.lcod.converter.graph.ExecutionOrderResolver;
import work.lcod.converter.graph.Workflow;
import work.lcod.converter.graph.WorkflowGraphBuilder;
import work.lcod.converter.graph.WorkflowNode;
import work.lcod.converter.script.ScriptAssembler;
import work.lcod.converter.script.ScriptStatistics;

/**
 * Public entry point for embedding the converter.
 *
 * <p>{@link #parse(byte[])} publishes a {@link Workflow} only when the whole document was read; a failed parse
 * leaves nothing behind. Instances are not thread-safe; use one per conversion.
 */
public final class WorkflowConverter {
    private static final Logger log = LoggerFactory.getLogger(WorkflowConverter.class);

    private final ConverterConfiguration configuration;
    private final GeneratorRegistry registry;
    private Workflow workflow;
    private String lastError;

    public WorkflowConverter() {
        this(ConverterConfiguration.defaults());
    }

    public WorkflowConverter(ConverterConfiguration configuration) {
        this(configuration, GeneratorRegistry.standard());
    }

    public WorkflowConverter(ConverterConfiguration configuration, GeneratorRegistry registry) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ConverterConfiguration configuration() {
        return configuration;
    }

    public boolean parse(byte[] raw) {
        workflow = null;
        lastError = null;
        LoadResult loaded = DocumentLoader.load(raw);
        if (!loaded.isSuccess()) {
            lastError = loaded.error();
            return false;
        }
        try {
            Workflow built = WorkflowGraphBuilder.build(loaded.document().orElseThrow(), configuration.maxConfigDepth());
            workflow = built;
            log.info("Parsed workflow: {} nodes, {} connections", built.nodes().size(), built.connections().size());
            return true;
        } catch (WorkflowFormatException ex) {
            lastError = ex.getMessage();
            log.warn("Rejected workflow document: {}", ex.getMessage());
            return false;
        }
    }

    public Optional<String> lastError() {
        return Optional.ofNullable(lastError);
    }

    public Optional<Workflow> workflow() {
        return Optional.ofNullable(workflow);
    }

    public Optional<WorkflowNode> node(String id) {
        return requireWorkflow().node(id);
    }

    public List<String> upstream(String id) {
        return requireWorkflow().upstream(id);
    }

    public List<String> downstream(String id) {
        return requireWorkflow().downstream(id);
    }

    public ExecutionOrder executionOrder() {
        return ExecutionOrderResolver.resolve(requireWorkflow());
    }

    public WorkflowAnalysis analyze() {
        Workflow current = requireWorkflow();
        return WorkflowAnalyzer.analyze(current, ExecutionOrderResolver.resolve(current));
    }

    public String generate() {
        Workflow current = requireWorkflow();
        ExecutionOrder order = ExecutionOrderResolver.resolve(current);
        return generate(current, order).script();
    }

    /**
     * Parses and generates in one go and reports the outcome instead of throwing.
     */
    public ConversionResult convert(byte[] raw, String sourceName) {
        var started = Instant.now();
        var meta = new LinkedHashMap<String, Object>();
        meta.put("source", sourceName);
        if (!parse(raw)) {
            return ConversionResult.failure(lastError, meta, started);
        }
        Workflow current = workflow;
        ExecutionOrder order = ExecutionOrderResolver.resolve(current);
        Generated generated = generate(current, order);

        meta.put("workflow", current.metadata().toMap());
        meta.put("analysis", WorkflowAnalyzer.analyze(current, order).toMap());
        meta.put("nodes", current.nodes().stream().map(node -> describe(current, node)).toList());
        meta.put("statistics", ScriptStatistics.of(generated.script()).toMap());
        meta.put("bindings", generated.emission().bindings());
        meta.put("manualCompletion", generated.emission().manualCompletionCount());
        if (!order.isComplete()) {
            return ConversionResult.partial(generated.script(), meta, started);
        }
        return ConversionResult.success(generated.script(), meta, started);
    }

    private Generated generate(Workflow current, ExecutionOrder order) {
        if (!order.isComplete()) {
            log.warn("Dependency cycle: {} of {} nodes could not be scheduled ({})",
                order.unscheduled().size(), order.totalNodes(), String.join(", ", order.unscheduled()));
        }
        var emission = new CodeEmitter(registry, configuration.variablePrefix()).emit(current, order);
        var assembler = new ScriptAssembler(
            configuration.scriptTitle(),
            configuration.indent(),
            configuration.baseImports(),
            configuration.generatedAt()
        );
        return new Generated(assembler.assemble(current.metadata(), order, emission), emission);
    }

    private Workflow requireWorkflow() {
        if (workflow == null) {
            throw new IllegalStateException("No workflow parsed" + (lastError == null ? "" : ": " + lastError));
        }
        return workflow;
    }

    private record Generated(String script, CodeEmitter.Emission emission) {}

    private static Map<String, Object> describe(Workflow current, WorkflowNode node) {
        var map = new LinkedHashMap<String, Object>();
        map.put("id", node.id());
        map.put("type", node.toolType().tag());
        map.put("annotation", node.annotation().orElse(null));
        map.put("upstream", current.upstream(node.id()));
        map.put("downstream", current.downstream(node.id()));
        return map;
    }
}
