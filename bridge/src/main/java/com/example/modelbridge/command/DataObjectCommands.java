package com.example.modelbridge.command;

import com.example.modelbridge.command.args.AddDataObjectPropsArgs;
import com.example.modelbridge.command.args.CreateDataObjectArgs;
import com.example.modelbridge.command.args.MoveDataObjectPropArgs;
import com.example.modelbridge.command.args.UpdateDataObjectArgs;
import com.example.modelbridge.command.args.UpdateDataObjectPropArgs;
import com.example.modelbridge.document.ChildCollection;
import com.example.modelbridge.document.ModelDocumentStore;
import com.example.modelbridge.document.ModelKeys;
import com.example.modelbridge.document.ModelNodes;
import com.example.modelbridge.resolve.EntityResolver;
import com.example.modelbridge.resolve.ResolvedEntity;
import com.example.modelbridge.validation.MutationValidator;
import com.example.modelbridge.validation.ValidationError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Commands creating and editing data objects and their properties.
 */
@Slf4j
@RequiredArgsConstructor
public class DataObjectCommands implements CommandGroup {

    static final String UNKNOWN_LOOKUP_VALUE = "Unknown";

    private final JsonMapper jsonMapper;
    private final ModelDocumentStore store;
    private final EntityResolver resolver;
    private final MutationValidator validator;
    private final ChildItemOperations childItems;

    @Override
    public List<CommandDefinition<?>> commands() {
        return List.of(
                CommandDefinition.mutation("create_data_object",
                        "Create a data object under an existing parent object", CreateDataObjectArgs.class, this::create),
                CommandDefinition.mutation("update_data_object",
                        "Update the description of a data object", UpdateDataObjectArgs.class, this::update),
                CommandDefinition.mutation("add_data_object_props",
                        "Append properties to a data object (all or none)", AddDataObjectPropsArgs.class, this::addProps),
                CommandDefinition.mutation("update_data_object_prop",
                        "Merge fields into a data object property", UpdateDataObjectPropArgs.class, this::updateProp),
                CommandDefinition.mutation("move_data_object_prop",
                        "Move a data object property to a new 0-based position", MoveDataObjectPropArgs.class, this::moveProp)
        );
    }

    ObjectNode create(CreateDataObjectArgs args) {
        String isLookup = args.isLookup() != null ? args.isLookup() : ModelKeys.FALSE;
        List<ValidationError> errors = new ArrayList<>();
        validator.checkNewObjectName(args.name(), "name", errors);
        validator.checkParentObject(args.parentObjectName(), "parentObjectName", errors);
        validator.checkFlag(isLookup, "isLookup", errors);
        validator.checkLookupParent(isLookup, args.parentObjectName(), "parentObjectName", errors);
        MutationValidator.throwIfInvalid(errors);

        boolean lookup = ModelKeys.TRUE.equals(isLookup);
        ObjectNode object = jsonMapper.createObjectNode();
        object.put(ModelKeys.NAME, args.name());
        object.put(ModelKeys.PARENT_OBJECT_NAME, args.parentObjectName());
        object.put(ModelKeys.IS_LOOKUP, isLookup);
        if (!ModelNodes.isBlank(args.codeDescription())) {
            object.put(ModelKeys.CODE_DESCRIPTION, args.codeDescription());
        }
        object.putArray(ModelKeys.PROP);
        object.putArray(ModelKeys.PROP_SUBSCRIPTION);
        object.putArray(ModelKeys.MODEL_PKG);
        ArrayNode lookupItems = object.putArray(ModelKeys.LOOKUP_ITEM);
        if (lookup) {
            lookupItems.addObject()
                    .put(ModelKeys.NAME, UNKNOWN_LOOKUP_VALUE)
                    .put("displayName", UNKNOWN_LOOKUP_VALUE)
                    .put("description", UNKNOWN_LOOKUP_VALUE)
                    .put("isActive", ModelKeys.TRUE);
        }

        ObjectNode namespace = namespaceOf(args.parentObjectName());
        store.applyAtomically("create data object " + args.name(),
                () -> store.insert(store.ensureList(namespace, ModelKeys.OBJECT), object));
        log.info("Created data object name={} parent={} lookup={}", args.name(), args.parentObjectName(), lookup);

        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("message", "Created data object '" + args.name() + "'");
        payload.put("name", args.name());
        payload.set("object", object.deepCopy());
        return payload;
    }

    ObjectNode update(UpdateDataObjectArgs args) {
        ResolvedEntity object = resolver.resolveObject(args.name()).orElseThrow();
        store.applyAtomically("update data object " + args.name(), () -> {
            object.node().put(ModelKeys.CODE_DESCRIPTION, args.codeDescription());
            return object.node();
        });
        log.info("Updated data object name={}", args.name());

        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("message", "Updated data object '" + args.name() + "'");
        payload.put("name", args.name());
        payload.put(ModelKeys.CODE_DESCRIPTION, args.codeDescription());
        return payload;
    }

    ObjectNode addProps(AddDataObjectPropsArgs args) {
        ResolvedEntity object = resolver.resolveObject(args.objectName()).orElseThrow();
        List<ObjectNode> siblings = new ArrayList<>(store.children(object.node(), ModelKeys.PROP));
        List<ObjectNode> accepted = new ArrayList<>();
        List<ValidationError> errors = new ArrayList<>();
        for (int i = 0; i < args.props().size(); i++) {
            JsonNode candidate = args.props().get(i);
            String prefix = "props[" + i + "]";
            if (candidate == null || !candidate.isObject()) {
                errors.add(new ValidationError(prefix, "each property must be a JSON object"));
                continue;
            }
            ObjectNode prop = (ObjectNode) candidate;
            validator.checkSiblingName(ChildCollection.OBJECT_PROP, siblings, null, ModelNodes.name(prop),
                    prefix + "." + ModelKeys.NAME, errors);
            validator.checkAttributes(prop, prefix, errors);
            siblings.add(prop);
            accepted.add(prop.deepCopy());
        }
        MutationValidator.throwIfInvalid(errors);

        int count = store.applyAtomically("add properties to " + args.objectName(), () -> {
            ArrayNode props = store.ensureList(object.node(), ModelKeys.PROP);
            accepted.forEach(prop -> store.insert(props, prop));
            return props.size();
        });
        List<String> names = accepted.stream().map(ModelNodes::name).toList();
        log.info("Added properties to data object name={} props={}", args.objectName(), names);

        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("message", "Added " + names.size() + " propert" + (names.size() == 1 ? "y" : "ies")
                + " to '" + args.objectName() + "'");
        payload.put("objectName", args.objectName());
        ArrayNode added = payload.putArray("added");
        names.forEach(added::add);
        payload.put("count", count);
        return payload;
    }

    ObjectNode updateProp(UpdateDataObjectPropArgs args) {
        ResolvedEntity object = resolver.resolveObject(args.objectName()).orElseThrow();
        return childItems.update(ChildCollection.OBJECT_PROP, object, args.propName(), args.updateFields(), "updateFields");
    }

    ObjectNode moveProp(MoveDataObjectPropArgs args) {
        ResolvedEntity object = resolver.resolveObject(args.objectName()).orElseThrow();
        return childItems.move(ChildCollection.OBJECT_PROP, object, args.propName(), args.newPosition());
    }

    /** The namespace holding {@code objectName}, or the first namespace. */
    private ObjectNode namespaceOf(String objectName) {
        List<ObjectNode> namespaces = store.namespaces();
        for (ObjectNode namespace : namespaces) {
            boolean holds = store.children(namespace, ModelKeys.OBJECT).stream()
                    .anyMatch(o -> ModelNodes.name(o).equals(objectName));
            if (holds) {
                return namespace;
            }
        }
        if (namespaces.isEmpty()) {
            throw new IllegalStateException("Model has no namespace");
        }
        return namespaces.get(0);
    }
}
