package io.github.flameyossnowy.geofilter.api.backend;

import io.github.flameyossnowy.geofilter.api.expression.BuiltExpression;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.session.CancellationToken;
import io.github.flameyossnowy.geofilter.api.session.FilterSession;
import org.jetbrains.annotations.NotNull;

public record ExecutionRequest(
    @NotNull FilterSession session,
    @NotNull LayerInfo target,
    @NotNull BuiltExpression built,
    @NotNull CancellationToken cancellation
) {}
