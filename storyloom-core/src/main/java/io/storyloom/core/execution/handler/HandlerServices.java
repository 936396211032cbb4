package io.storyloom.core.execution.handler;

import io.storyloom.core.condition.ConditionEvaluator;
import io.storyloom.core.execution.parallel.ItemSplitter;
import io.storyloom.core.execution.parallel.ResultMerger;
import io.storyloom.core.json.JsonCodec;
import io.storyloom.core.setting.SettingsInjector;
import io.storyloom.core.setting.SettingsProvider;
import java.util.Objects;

/// Stateless collaborators shared by all handlers of a run.
public record HandlerServices(
        ConditionEvaluator conditionEvaluator,
        SettingsInjector settingsInjector,
        SettingsProvider settingsProvider,
        JsonCodec jsonCodec,
        ItemSplitter itemSplitter,
        ResultMerger resultMerger) {

    public HandlerServices {
        Objects.requireNonNull(conditionEvaluator, "conditionEvaluator must not be null");
        Objects.requireNonNull(settingsInjector, "settingsInjector must not be null");
        Objects.requireNonNull(settingsProvider, "settingsProvider must not be null");
        Objects.requireNonNull(jsonCodec, "jsonCodec must not be null");
        Objects.requireNonNull(itemSplitter, "itemSplitter must not be null");
        Objects.requireNonNull(resultMerger, "resultMerger must not be null");
    }

    /// Creates the built-in services around a settings provider and JSON codec.
    public static HandlerServices create(SettingsProvider settingsProvider, JsonCodec jsonCodec) {
        return new HandlerServices(
                new ConditionEvaluator(),
                new SettingsInjector(),
                settingsProvider,
                jsonCodec,
                new ItemSplitter(jsonCodec),
                new ResultMerger(jsonCodec));
    }
}
