/**
 * REST API layer: controller and response DTOs.
 *
 * <p>Endpoints under {@code /api/v1}:
 * <ul>
 *   <li>{@code POST /ingestions} - run an ingestion, returns the report</li>
 *   <li>{@code GET /ingestions/status} - pipeline state</li>
 *   <li>{@code GET /ingestions/last} - last report</li>
 *   <li>{@code GET /graph/summary} - node and relationship counts</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.itemgraph.api;
