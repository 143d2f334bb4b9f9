import io.github.flameyossnowy.geofilter.api.backend.BackendCapability;
import io.github.flameyossnowy.geofilter.api.backend.BackendMetrics;
import io.github.flameyossnowy.geofilter.api.backend.FilterBackend;
import io.github.flameyossnowy.geofilter.api.backend.FilterExecutor;
import io.github.flameyossnowy.geofilter.api.buffer.BufferConfig;
import io.github.flameyossnowy.geofilter.api.expression.BuildOptions;
import io.github.flameyossnowy.geofilter.api.expression.BuiltExpression;
import io.github.flameyossnowy.geofilter.api.expression.ExpressionBuilder;
import io.github.flameyossnowy.geofilter.api.expression.FilterExpression;
import io.github.flameyossnowy.geofilter.api.layer.Dialect;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.layer.StorageKind;
import io.github.flameyossnowy.geofilter.api.predicate.CombineOperator;
import io.github.flameyossnowy.geofilter.api.predicate.PredicateSet;
import io.github.flameyossnowy.geofilter.api.result.FilterResult;
import io.github.flameyossnowy.geofilter.api.source.SourceGeometryRef;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Backend whose build and execute steps are swapped per test.
 */
final class StubBackend implements FilterBackend {
    interface BuildStep {
        BuiltExpression build(SourceGeometryRef source, PredicateSet predicates, LayerInfo target);
    }

    private final String name;
    private final StorageKind kind;
    private final Set<BackendCapability> capabilities;
    private final BackendMetrics metrics;
    final List<SourceGeometryRef> seenSources = new ArrayList<>();

    BuildStep buildStep;
    FilterExecutor executor;

    StubBackend(String name, StorageKind kind) {
        this(name, kind, EnumSet.of(BackendCapability.SPATIAL_FILTER));
    }

    StubBackend(String name, StorageKind kind, Set<BackendCapability> capabilities) {
        this.name = name;
        this.kind = kind;
        this.capabilities = capabilities;
        this.metrics = new BackendMetrics(name);
        this.buildStep = (source, predicates, target) -> new BuiltExpression(
            kind.dialect(),
            new FilterExpression(name + ":" + target.id(), !predicates.isEmpty(), List.of()),
            List.of()
        );
        this.executor = request -> FilterResult.success(request.target().id(), name, List.of(1L), request.built().raw(), 0, false);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public StorageKind storageKind() {
        return kind;
    }

    @Override
    public Set<BackendCapability> capabilities() {
        return capabilities;
    }

    @Override
    public ExpressionBuilder builder() {
        return new ExpressionBuilder() {
            @Override
            public Dialect dialect() {
                return kind.dialect();
            }

            @Override
            public BuiltExpression build(SourceGeometryRef source, PredicateSet predicates, CombineOperator operator,
                                         BufferConfig buffer, LayerInfo target, BuildOptions options) {
                seenSources.add(source);
                return buildStep.build(source, predicates, target);
            }
        };
    }

    @Override
    public FilterExecutor executor() {
        return request -> executor.execute(request);
    }

    @Override
    public BackendMetrics metrics() {
        return metrics;
    }
}
