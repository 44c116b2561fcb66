// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.html;

import tessera.dom.Elements;

/**
 * The category of an open element, as far as implicit closing is concerned.
 */
enum TagCategory {
    PARAGRAPH,
    HEADING,
    TABLE,
    FORM,
    LIST_ITEM,
    DESCRIPTION_TERM,
    DESCRIPTION_DETAILS,
    TABLE_ROW,
    TABLE_DATA,
    TABLE_HEADER,
    VOID,
    OTHER;

    static TagCategory of(final String tagName) {
        return switch (tagName) {
            case "p" -> PARAGRAPH;
            case "h1", "h2", "h3", "h4", "h5", "h6" -> HEADING;
            case "table" -> TABLE;
            case "form" -> FORM;
            case "li" -> LIST_ITEM;
            case "dt" -> DESCRIPTION_TERM;
            case "dd" -> DESCRIPTION_DETAILS;
            case "tr" -> TABLE_ROW;
            case "td" -> TABLE_DATA;
            case "th" -> TABLE_HEADER;
            default -> Elements.isVoid(tagName) ? VOID : OTHER;
        };
    }

    /**
     * Returns whether opening an element of this category closes an open element of the {@code top} category sitting
     * at the top of the stack.
     */
    boolean closes(final TagCategory top) {
        return switch (this) {
            case PARAGRAPH, HEADING, TABLE, FORM -> top == PARAGRAPH;
            case LIST_ITEM -> top == LIST_ITEM;
            case DESCRIPTION_TERM, DESCRIPTION_DETAILS -> top == DESCRIPTION_TERM || top == DESCRIPTION_DETAILS;
            case TABLE_ROW -> top == TABLE_ROW;
            case TABLE_DATA, TABLE_HEADER -> top.isTableCell();
            case VOID, OTHER -> false;
        };
    }

    boolean isTableCell() {
        return this == TABLE_DATA || this == TABLE_HEADER;
    }
}
