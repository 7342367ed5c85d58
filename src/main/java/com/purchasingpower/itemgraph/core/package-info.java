/**
 * Core domain model of the item graph.
 *
 * <p>Contains the node and relationship kinds plus the values passed between
 * pipeline stages:
 * <ul>
 *   <li>RawRecord - field bag as read from an export file</li>
 *   <li>NormalizedNode - canonical node with defaults applied</li>
 *   <li>GraphEdge - resolved relationship keyed by (source, kind, target)</li>
 * </ul>
 *
 * <p>No Spring or store dependencies live here.
 *
 * @since 1.0.0
 */
package com.purchasingpower.itemgraph.core;
