package com.purchasingpower.itemgraph.normalize;

import com.purchasingpower.itemgraph.core.NodeKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Field tables for every ingested node kind.
 *
 * <p>Adding a field or a kind is a change to these tables only; the normalizer
 * has no per-kind branches.
 *
 * @since 1.0.0
 */
@Component
public class NodeSchemaRegistry {

    public static final String UNIQUE_NAME = "uniqueName";
    public static final String PRODUCT_CATEGORY = "productCategory";
    public static final String RESULT_TYPE = "resultType";
    public static final String OUTPUT_QUANTITY = "num";
    public static final String INGREDIENTS = "ingredients";
    public static final String INGREDIENT_ITEM = "ItemType";
    public static final String INGREDIENT_COUNT = "ItemCount";

    private final Map<NodeKind, NodeSchema> schemas = new EnumMap<>(NodeKind.class);

    public NodeSchemaRegistry() {
        register(weaponSchema());
        register(resourceSchema());
        register(recipeSchema());
    }

    public NodeSchema get(NodeKind kind) {
        NodeSchema schema = schemas.get(kind);
        if (schema == null) {
            throw new IllegalArgumentException("No field table for node kind " + kind);
        }
        return schema;
    }

    private void register(NodeSchema schema) {
        schemas.put(schema.getKind(), schema);
    }

    private static NodeSchema weaponSchema() {
        return NodeSchema.builder()
                .kind(NodeKind.WEAPON)
                .identifierField(UNIQUE_NAME)
                .categoryField(PRODUCT_CATEGORY)
                .field(FieldRule.string("name"))
                .field(FieldRule.string("description"))
                .field(FieldRule.string(PRODUCT_CATEGORY))
                .field(FieldRule.stat("accuracy"))
                .field(FieldRule.count("blockingAngle"))
                .field(FieldRule.bool("codexSecret"))
                .field(FieldRule.count("comboDuration"))
                .field(FieldRule.chance("criticalChance"))
                .field(FieldRule.stat("criticalMultiplier"))
                .field(FieldRule.numbers("damagePerShot"))
                .field(FieldRule.bool("excludeFromCodex"))
                .field(FieldRule.stat("fireRate"))
                .field(FieldRule.stat("followThrough"))
                .field(FieldRule.count("heavyAttackDamage"))
                .field(FieldRule.count("heavySlamAttack"))
                .field(FieldRule.count("heavySlamRadialDamage"))
                .field(FieldRule.count("heavySlamRadius"))
                .field(FieldRule.count("magazineSize"))
                .field(FieldRule.count("masteryReq"))
                .field(FieldRule.count("maxLevelCap"))
                .field(FieldRule.count("multishot"))
                .field(FieldRule.string("noise"))
                .field(FieldRule.stat("omegaAttenuation"))
                .field(FieldRule.stat("primeOmegaAttenuation"))
                .field(FieldRule.chance("procChance"))
                .field(FieldRule.stat("range"))
                .field(FieldRule.stat("reloadTime"))
                .field(FieldRule.bool("sentinel"))
                .field(FieldRule.count("slamAttack"))
                .field(FieldRule.count("slamRadialDamage"))
                .field(FieldRule.count("slamRadius"))
                .field(FieldRule.count("slideAttack"))
                .field(FieldRule.integer("slot"))
                .field(FieldRule.stat("totalDamage"))
                .field(FieldRule.string("trigger"))
                .field(FieldRule.stat("windUp"))
                .build();
    }

    private static NodeSchema resourceSchema() {
        return NodeSchema.builder()
                .kind(NodeKind.RESOURCE)
                .identifierField(UNIQUE_NAME)
                .field(FieldRule.string("name"))
                .field(FieldRule.string("description"))
                .field(FieldRule.string("longDescription"))
                .field(FieldRule.string("parentName"))
                .field(FieldRule.bool("codexSecret"))
                .field(FieldRule.bool("excludeFromCodex"))
                .field(FieldRule.bool("showInInventory"))
                .field(FieldRule.count("primeSellingPrice"))
                .build();
    }

    private static NodeSchema recipeSchema() {
        return NodeSchema.builder()
                .kind(NodeKind.RECIPE)
                .identifierField(UNIQUE_NAME)
                .field(FieldRule.string(RESULT_TYPE))
                .field(FieldRule.bool("alwaysAvailable"))
                .field(FieldRule.count("buildPrice"))
                .field(FieldRule.count("buildTime"))
                .field(FieldRule.bool("codexSecret"))
                .field(FieldRule.bool("consumeOnUse"))
                .field(FieldRule.bool("excludeFromCodex"))
                .field(FieldRule.count(OUTPUT_QUANTITY).withDefault(1L))
                .field(FieldRule.count("primeSellingPrice"))
                .field(FieldRule.count("skipBuildTimePrice"))
                .field(FieldRule.ingredients(INGREDIENTS))
                .build();
    }
}
