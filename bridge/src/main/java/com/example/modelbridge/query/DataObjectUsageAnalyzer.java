package com.example.modelbridge.query;

import com.example.modelbridge.document.ModelDocumentStore;
import com.example.modelbridge.document.ModelKeys;
import com.example.modelbridge.document.ModelNodes;
import com.example.modelbridge.document.WorkflowKind;
import lombok.RequiredArgsConstructor;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

/**
 * Finds where a data object is referenced: as the owner of forms, reports and flows, as the target
 * of a form or report, as the source of a report column, as a foreign key target, and as a parent.
 */
@RequiredArgsConstructor
public class DataObjectUsageAnalyzer {

    private final JsonMapper jsonMapper;
    private final ModelDocumentStore store;

    /** One summary per data object, in tree order. */
    public ArrayNode summary() {
        ArrayNode summary = jsonMapper.createArrayNode();
        for (ObjectNode object : store.allObjects()) {
            String name = ModelNodes.name(object);
            ArrayNode references = references(name);
            ObjectNode entry = summary.addObject();
            entry.put("dataObjectName", name);
            entry.put("isLookup", ModelNodes.isTrue(object, ModelKeys.IS_LOOKUP));
            entry.put("totalReferences", references.size());
            entry.put("formReferences", count(references, "form"));
            entry.put("reportReferences", count(references, "report"));
            entry.put("flowReferences", count(references, "flow"));
            entry.put("propertyReferences", count(references, "property"));
            entry.put("childObjectReferences", count(references, "object"));
        }
        return summary;
    }

    /** Every reference to {@code objectName}; names compare exactly. */
    public ArrayNode references(String objectName) {
        ArrayNode references = jsonMapper.createArrayNode();
        for (ObjectNode object : store.allObjects()) {
            String ownerName = ModelNodes.name(object);
            boolean owned = ownerName.equals(objectName);

            for (ObjectNode workflow : store.children(object, ModelKeys.OBJECT_WORKFLOW)) {
                WorkflowKind kind = WorkflowKind.classify(workflow);
                String itemType = kind == WorkflowKind.FORM ? "form" : "flow";
                if (owned) {
                    add(references, "Owner Object", itemType, ModelNodes.name(workflow), ownerName);
                }
                if (objectName.equals(ModelNodes.text(workflow, ModelKeys.TARGET_CHILD_OBJECT))) {
                    add(references, "Target Child Object", itemType, ModelNodes.name(workflow), ownerName);
                }
            }
            for (ObjectNode report : store.children(object, ModelKeys.REPORT)) {
                if (owned) {
                    add(references, "Owner Object", "report", ModelNodes.name(report), ownerName);
                }
                if (objectName.equals(ModelNodes.text(report, ModelKeys.TARGET_CHILD_OBJECT))) {
                    add(references, "Target Child Object", "report", ModelNodes.name(report), ownerName);
                }
                for (ObjectNode column : store.children(report, ModelKeys.REPORT_COLUMN)) {
                    if (objectName.equals(ModelNodes.text(column, "sourceObjectName"))) {
                        add(references, "Report Column Source Object", "report",
                                ModelNodes.name(report) + "." + ModelNodes.name(column), ownerName);
                    }
                }
            }
            for (ObjectNode prop : store.children(object, ModelKeys.PROP)) {
                if (objectName.equals(ModelNodes.text(prop, ModelKeys.FK_OBJECT_NAME))) {
                    add(references, "Foreign Key Target", "property",
                            ownerName + "." + ModelNodes.name(prop), ownerName);
                }
            }
            if (objectName.equals(ModelNodes.text(object, ModelKeys.PARENT_OBJECT_NAME))) {
                add(references, "Parent Object", "object", ownerName, ownerName);
            }
        }
        return references;
    }

    private static void add(ArrayNode references, String referenceType, String itemType, String referencedBy,
                            String ownerObjectName) {
        references.addObject()
                .put("referenceType", referenceType)
                .put("itemType", itemType)
                .put("referencedBy", referencedBy)
                .put("ownerObjectName", ownerObjectName);
    }

    private static int count(ArrayNode references, String itemType) {
        int count = 0;
        for (var reference : references) {
            if (itemType.equals(ModelNodes.text(reference, "itemType"))) {
                count++;
            }
        }
        return count;
    }
}
