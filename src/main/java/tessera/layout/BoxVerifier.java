// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

import java.util.ArrayList;
import tessera.dom.Document;
import tessera.dom.Node;
import tessera.util.UnreachableCodeReachedError;
import tessera.util.condition.ConditionContext;

/**
 * The box tree verifier.
 * <p>
 * Checks that a box tree belongs to the document it's about to be published with: it must have been laid out from the
 * same document generation, every box and run must refer to a node of that document of the right kind, and all
 * geometry must be finite and non-negative in size.
 */
public final class BoxVerifier {
    private BoxVerifier(final Document document) {
        this.document = document;
    }

    /**
     * Verifies the given box tree against the given document.
     * <p>
     * If the tree is valid, this method simply returns. Otherwise a fatal condition of type
     * {@link InvariantViolationCondition} is signaled.
     */
    public static void verify(final BoxTree tree, final Document document) {
        final var verifier = new BoxVerifier(document);
        if (tree.generation() != document.generation()) {
            verifier.recordViolation("Box tree of generation " + tree.generation() + " paired with document of generation "
                + document.generation());
        }
        tree.forEachBox(verifier::verifyBox);
        if (!verifier.violations.isEmpty()) {
            throw ConditionContext.error(new InvariantViolationCondition(verifier.violations));
        }
    }

    private void verifyBox(final Box box) {
        if (!box.geometry().isWellFormed()) {
            recordViolation("Box of node " + box.nodeId() + " has malformed geometry " + box.geometry());
        }
        if (!isContainer(box.nodeId())) {
            recordViolation("Box refers to node " + box.nodeId() + ", which isn't an element of this document");
        }
        if (box instanceof Box.Inline inline) {
            for (final var line : inline.lines()) {
                verifyLine(line);
            }
        } else if (!(box instanceof Box.Block)) {
            throw new UnreachableCodeReachedError("Unknown box type: " + box);
        }
    }

    private void verifyLine(final Line line) {
        if (!line.geometry().isWellFormed()) {
            recordViolation("Line has malformed geometry " + line.geometry());
        }
        for (final var run : line.runs()) {
            if (!run.geometry().isWellFormed()) {
                recordViolation("Text run '" + run.text() + "' has malformed geometry " + run.geometry());
            }
            if (!document.contains(run.nodeId()) || !(document.node(run.nodeId()) instanceof Node.Text)) {
                recordViolation("Text run '" + run.text() + "' refers to node " + run.nodeId()
                    + ", which isn't a text node of this document");
            }
        }
    }

    private boolean isContainer(final int id) {
        return document.contains(id) && (id == Document.ROOT || document.isElement(id));
    }

    private void recordViolation(final String message) {
        violations.add(message);
    }

    private final Document document;
    private final ArrayList<String> violations = new ArrayList<>();
}
