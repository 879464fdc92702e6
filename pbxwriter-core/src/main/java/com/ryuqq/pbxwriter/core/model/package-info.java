/**
 * PBX object graph model.
 *
 * <h2>Node Kinds</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pbxwriter.core.model.PbxString} - String scalar</li>
 *   <li>{@link com.ryuqq.pbxwriter.core.model.PbxObjectRef} - Non-owning reference to an object</li>
 *   <li>{@link com.ryuqq.pbxwriter.core.model.PbxObjectList} - Ordered list of nodes</li>
 *   <li>{@link com.ryuqq.pbxwriter.core.model.PbxAttributeGroup} - Named attributes without identity</li>
 *   <li>{@link com.ryuqq.pbxwriter.core.model.PbxObject} - Identified object with category (isa)</li>
 * </ul>
 *
 * <h2>Construction</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pbxwriter.core.model.PbxGraph} - Owns the id registry and the ordered root objects</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Closed variants:</strong> {@code PbxNode} is sealed; printing dispatches on {@code NodeKind}</li>
 *   <li><strong>Stable ordering:</strong> attributes and list elements keep insertion order</li>
 *   <li><strong>Read-only printing:</strong> the graph is frozen while it is printed</li>
 * </ul>
 *
 * @since 1.0.0
 * @author PBX Writer Team
 */
package com.ryuqq.pbxwriter.core.model;
