package com.example.modelbridge.validation;

import com.example.modelbridge.document.ModelDocumentStore;
import com.example.modelbridge.document.ModelKeys;
import com.example.modelbridge.document.ModelNodes;
import lombok.RequiredArgsConstructor;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks the text of a user story: it must name a known role and only data objects that exist.
 * <p>
 * Two phrasings are understood: {@code "A [Role] wants to ..."} and {@code "As a [Role], I want to ..."}.
 * Data objects are taken from {@code "view all X in Y"} or from the noun following an action verb
 * such as {@code add} or {@code delete}; a plural or singular form of a model object name counts as a match.
 * </p>
 */
@RequiredArgsConstructor
public class UserStoryValidator {

    private static final Pattern WANTS_TO = Pattern.compile("^A\\s+\\[?(\\w+(?:\\s+\\w+)*)\\]?\\s+wants to",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern I_WANT_TO = Pattern.compile("^As a\\s+\\[?(\\w+(?:\\s+\\w+)*)\\]?\\s*,?\\s*I want to",
            Pattern.CASE_INSENSITIVE);

    private static final String VIEW_ALL = "view all ";
    private static final List<String> ARTICLES = List.of("all ", "a ", "an ", "the ");
    private static final List<String> CONTAINER_ENDINGS = List.of(" for ", " to ", " when ", " where ", " with ", " by ", " from ");
    private static final List<String> ACTIONS = List.of("view ", "add ", "create ", "update ", "edit ", "delete ", "remove ");
    private static final List<String> OBJECT_BOUNDARIES = List.of(" in ", " for ", " to ", " when ", " where ", " with ",
            " by ", " from ", " of ", " and ", " or ");
    private static final String APPLICATION = "application";

    private final ModelDocumentStore store;

    /**
     * Appends at most one error for {@code field}: the first of a missing role, an unknown role or
     * unknown data objects.
     */
    public void checkStoryText(String text, String field, List<ValidationError> errors) {
        Optional<String> role = extractRole(text);
        if (role.isEmpty()) {
            errors.add(new ValidationError(field, "Unable to extract role from user story text"));
            return;
        }
        if (!isKnownRole(role.get())) {
            errors.add(new ValidationError(field, "Role \"" + role.get() + "\" does not exist in model"));
            return;
        }
        List<String> missing = extractDataObjects(text).stream()
                .filter(name -> !objectExists(name))
                .toList();
        if (!missing.isEmpty()) {
            errors.add(new ValidationError(field, "Data object(s) \"" + String.join(", ", missing)
                    + "\" do not exist in model"));
        }
    }

    static Optional<String> extractRole(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String collapsed = text.trim().replaceAll("\\s+", " ");
        for (Pattern pattern : List.of(WANTS_TO, I_WANT_TO)) {
            Matcher matcher = pattern.matcher(collapsed);
            if (matcher.find()) {
                return Optional.of(matcher.group(1).trim());
            }
        }
        return Optional.empty();
    }

    /** Lower-cased object phrases named by the story, in order of appearance. */
    static List<String> extractDataObjects(String text) {
        if (text == null) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT).trim();
        Set<String> names = new LinkedHashSet<>();

        int viewAll = lower.indexOf(VIEW_ALL);
        if (viewAll >= 0) {
            String rest = lower.substring(viewAll + VIEW_ALL.length());
            int in = rest.indexOf(" in ");
            if (in >= 0) {
                addIfPresent(names, stripArticle(rest.substring(0, in).trim()));
                String container = cutAt(stripArticle(rest.substring(in + 4).trim()), CONTAINER_ENDINGS);
                if (!APPLICATION.equals(container)) {
                    addIfPresent(names, container);
                }
                return new ArrayList<>(names);
            }
        }

        for (String action : ACTIONS) {
            int index = lower.indexOf(action);
            if (index >= 0) {
                String rest = stripArticle(lower.substring(index + action.length()).trim());
                addIfPresent(names, cutAt(rest, OBJECT_BOUNDARIES));
            }
        }
        return new ArrayList<>(names);
    }

    private boolean isKnownRole(String role) {
        List<ObjectNode> roleObjects = store.allObjects().stream()
                .filter(object -> {
                    String name = ModelNodes.name(object);
                    return name.equals(ModelKeys.ROLE_OBJECT_NAME) || name.toLowerCase(Locale.ROOT).contains("role");
                })
                .toList();
        if (roleObjects.isEmpty()) {
            return true;
        }
        return roleObjects.stream()
                .flatMap(object -> store.children(object, ModelKeys.LOOKUP_ITEM).stream())
                .anyMatch(item -> ModelNodes.name(item).equalsIgnoreCase(role)
                        || ModelNodes.text(item, "displayName").equalsIgnoreCase(role));
    }

    private boolean objectExists(String phrase) {
        String lower = phrase.toLowerCase(Locale.ROOT);
        String pascal = toPascalCase(phrase).toLowerCase(Locale.ROOT);
        String variant = lower.endsWith("s") && lower.length() > 1 ? lower.substring(0, lower.length() - 1) : lower + "s";
        return store.allObjects().stream()
                .map(object -> ModelNodes.name(object).toLowerCase(Locale.ROOT))
                .anyMatch(name -> name.equals(lower) || name.equals(pascal) || name.equals(variant));
    }

    static String toPascalCase(String phrase) {
        StringBuilder pascal = new StringBuilder();
        for (String word : phrase.split(" ")) {
            if (!word.isEmpty()) {
                pascal.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1).toLowerCase(Locale.ROOT));
            }
        }
        return pascal.toString();
    }

    private static String stripArticle(String phrase) {
        for (String article : ARTICLES) {
            if (phrase.startsWith(article)) {
                return phrase.substring(article.length());
            }
        }
        return phrase;
    }

    private static String cutAt(String phrase, List<String> boundaries) {
        for (String boundary : boundaries) {
            int index = phrase.indexOf(boundary);
            if (index >= 0) {
                return phrase.substring(0, index).trim();
            }
        }
        return phrase.trim();
    }

    private static void addIfPresent(Set<String> names, String name) {
        String trimmed = name.trim().replaceAll("[.!?,;:]+$", "");
        if (!trimmed.isEmpty()) {
            names.add(trimmed);
        }
    }
}
