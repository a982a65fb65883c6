package com.ivamare.ordersession.command;

import com.ivamare.ordersession.model.LineModifier;

import java.util.List;

/**
 * Add a line for a menu item, priced at command time.
 */
public record AddItem(
    Long itemId,
    Long variantId,
    String itemName,
    int quantity,
    List<LineModifier> modifiers,
    String notes
) implements SessionCommand {

    public AddItem {
        modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
    }

    public static AddItem of(long itemId, int quantity) {
        return new AddItem(itemId, null, null, quantity, List.of(), null);
    }
}
