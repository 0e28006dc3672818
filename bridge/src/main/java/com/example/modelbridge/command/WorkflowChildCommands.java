package com.example.modelbridge.command;

import com.example.modelbridge.command.args.AddChildArgs;
import com.example.modelbridge.command.args.MoveChildArgs;
import com.example.modelbridge.command.args.UpdateChildArgs;
import com.example.modelbridge.document.ChildCollection;
import com.example.modelbridge.document.WorkflowKind;
import com.example.modelbridge.resolve.EntityResolver;
import com.example.modelbridge.resolve.ResolvedEntity;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@code add_}, {@code update_} and {@code move_} commands for every child list of forms, reports,
 * general flows and page init flows, e.g. {@code add_form_param} or {@code move_report_column}.
 */
@RequiredArgsConstructor
public class WorkflowChildCommands implements CommandGroup {

    private final EntityResolver resolver;
    private final ChildItemOperations childItems;

    /** {@code form}, {@code report}, {@code general_flow} or {@code page_init_flow}. */
    static String commandNoun(WorkflowKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public List<CommandDefinition<?>> commands() {
        List<CommandDefinition<?>> commands = new ArrayList<>();
        for (ChildCollection collection : ChildCollection.values()) {
            if (collection.isObjectLevel()) {
                continue;
            }
            WorkflowKind kind = collection.workflowKind();
            String noun = commandNoun(kind);
            String suffix = noun + "_" + collection.argumentName();
            String containerArgument = noun + "_name";
            String item = collection.argumentName();
            String itemName = item + "_name";

            commands.add(CommandDefinition.<AddChildArgs>mutation("add_" + suffix,
                            "Append a " + collection.label() + " to a " + kind.label(), AddChildArgs.class,
                            args -> childItems.add(collection, container(kind, args.workflowName(), args.ownerObjectName()),
                                    args.item(), item))
                    .withArgumentLabels(Map.of("workflow_name", containerArgument, "item", item)));
            commands.add(CommandDefinition.<UpdateChildArgs>mutation("update_" + suffix,
                            "Merge fields into a " + kind.label() + " " + collection.label(), UpdateChildArgs.class,
                            args -> childItems.update(collection, container(kind, args.workflowName(), args.ownerObjectName()),
                                    args.itemName(), args.updates(), "updates"))
                    .withArgumentLabels(Map.of("workflow_name", containerArgument, "item_name", itemName)));
            commands.add(CommandDefinition.<MoveChildArgs>mutation("move_" + suffix,
                            "Move a " + kind.label() + " " + collection.label() + " to a new 0-based position",
                            MoveChildArgs.class,
                            args -> childItems.move(collection, container(kind, args.workflowName(), args.ownerObjectName()),
                                    args.itemName(), args.newPosition()))
                    .withArgumentLabels(Map.of("workflow_name", containerArgument, "item_name", itemName)));
        }
        return commands;
    }

    private ResolvedEntity container(WorkflowKind kind, String name, String ownerHint) {
        return resolver.resolveWorkflow(kind, name, ownerHint).requireUnambiguous();
    }
}
