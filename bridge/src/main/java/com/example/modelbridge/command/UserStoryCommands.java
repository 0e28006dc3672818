package com.example.modelbridge.command;

import com.example.modelbridge.api.EntityNotFoundException;
import com.example.modelbridge.command.args.CreateUserStoryArgs;
import com.example.modelbridge.command.args.UpdateUserStoryArgs;
import com.example.modelbridge.document.ModelDocumentStore;
import com.example.modelbridge.document.ModelKeys;
import com.example.modelbridge.document.ModelNodes;
import com.example.modelbridge.validation.MutationValidator;
import com.example.modelbridge.validation.UserStoryValidator;
import com.example.modelbridge.validation.ValidationError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@RequiredArgsConstructor
public class UserStoryCommands implements CommandGroup {

    static final String USER_STORY = "user story";

    private final JsonMapper jsonMapper;
    private final ModelDocumentStore store;
    private final MutationValidator validator;
    private final UserStoryValidator storyValidator;

    @Override
    public List<CommandDefinition<?>> commands() {
        return List.of(
                CommandDefinition.mutation("create_user_story",
                        "Append a user story to the first namespace", CreateUserStoryArgs.class, this::create),
                CommandDefinition.mutation("update_user_story",
                        "Set the isIgnored flag of a user story found by name", UpdateUserStoryArgs.class, this::update)
        );
    }

    ObjectNode create(CreateUserStoryArgs args) {
        List<ObjectNode> namespaces = store.namespaces();
        if (namespaces.isEmpty()) {
            throw new IllegalStateException("Model has no namespace");
        }
        ObjectNode namespace = namespaces.get(0);
        List<ObjectNode> stories = store.children(namespace, ModelKeys.USER_STORY);

        List<ValidationError> errors = new ArrayList<>();
        String text = args.storyText().trim();
        stories.stream()
                .filter(story -> ModelNodes.text(story, "storyText").trim().equalsIgnoreCase(text))
                .findFirst()
                .ifPresent(story -> errors.add(new ValidationError("storyText",
                        "an identical user story already exists (number " + ModelNodes.text(story, "storyNumber") + ")")));
        storyValidator.checkStoryText(text, "storyText", errors);
        String number = args.storyNumber();
        if (ModelNodes.isBlank(number)) {
            number = nextStoryNumber(stories).toString();
        } else if (!number.matches("\\d+") || new BigInteger(number).signum() == 0) {
            errors.add(new ValidationError("storyNumber", "storyNumber must be a positive integer"));
        } else {
            String wanted = number;
            if (stories.stream().anyMatch(story -> ModelNodes.text(story, "storyNumber").equals(wanted))) {
                errors.add(new ValidationError("storyNumber", "user story number " + wanted + " is already used"));
            }
        }
        MutationValidator.throwIfInvalid(errors);

        ObjectNode story = jsonMapper.createObjectNode();
        story.put(ModelKeys.NAME, UUID.randomUUID().toString());
        story.put("storyNumber", number);
        story.put("storyText", text);
        story.put("isIgnored", ModelKeys.FALSE);
        store.applyAtomically("create user story " + number,
                () -> store.insert(store.ensureList(namespace, ModelKeys.USER_STORY), story));
        log.info("Created user story number={}", number);

        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("message", "Created user story " + number);
        payload.set("story", story.deepCopy());
        return payload;
    }

    ObjectNode update(UpdateUserStoryArgs args) {
        List<ValidationError> errors = new ArrayList<>();
        validator.checkFlag(args.isIgnored(), "isIgnored", errors);
        MutationValidator.throwIfInvalid(errors);

        ObjectNode story = store.namespaces().stream()
                .flatMap(namespace -> store.children(namespace, ModelKeys.USER_STORY).stream())
                .filter(candidate -> ModelNodes.name(candidate).equals(args.name()))
                .findFirst()
                .orElseThrow(() -> new EntityNotFoundException(USER_STORY, args.name(), null));
        ObjectNode fields = jsonMapper.createObjectNode();
        fields.put("isIgnored", args.isIgnored());
        store.applyAtomically("update user story " + args.name(), () -> store.update(story, fields, ModelKeys.NAME));
        log.info("Updated user story name={} isIgnored={}", args.name(), args.isIgnored());

        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("message", "User story \"" + args.name() + "\" updated");
        payload.set("userStory", story.deepCopy());
        return payload;
    }

    private static BigInteger nextStoryNumber(List<ObjectNode> stories) {
        BigInteger max = BigInteger.ZERO;
        for (ObjectNode story : stories) {
            String number = ModelNodes.text(story, "storyNumber");
            if (number.matches("\\d+")) {
                max = max.max(new BigInteger(number));
            }
        }
        return max.add(BigInteger.ONE);
    }
}
