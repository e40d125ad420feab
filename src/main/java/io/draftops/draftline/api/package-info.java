/**
 * Command-line entry points that replay draft captures through the engine.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, configures logging and telemetry, and invokes the
 * engine through {@code CompositionRoot}.</p>
 */
package io.draftops.draftline.api;
