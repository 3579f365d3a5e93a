package it.netdicom.presentation;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import it.netdicom.sop.Uids;

/**
 * A presentation context proposed by the association requestor.
 */
public record PresentationContext(int identifier, String abstractSyntax, List<String> transferSyntaxes) {

    public static final int MAX_CONTEXTS = 128;

    public PresentationContext {
        transferSyntaxes = transferSyntaxes == null ? List.of() : List.copyOf(transferSyntaxes);
    }

    public void validate() {
        if (identifier < 1 || identifier > 255 || identifier % 2 == 0) {
            throw new IllegalArgumentException("Presentation context identifier must be an odd integer between 1 and 255, got " + identifier);
        }
        Uids.require(abstractSyntax, "abstract syntax");
        if (transferSyntaxes.isEmpty()) {
            throw new IllegalArgumentException("At least one transfer syntax must be provided for context " + identifier);
        }
        for (String transferSyntax : transferSyntaxes) {
            Uids.require(transferSyntax, "transfer syntax");
        }
    }

    public static void validateProposal(List<PresentationContext> proposed) {
        if (proposed == null || proposed.isEmpty()) {
            throw new IllegalArgumentException("At least one presentation context proposal is required");
        }
        if (proposed.size() > MAX_CONTEXTS) {
            throw new IllegalArgumentException("At most " + MAX_CONTEXTS + " presentation contexts may be proposed, got " + proposed.size());
        }
        Set<Integer> identifiers = new HashSet<>();
        for (PresentationContext context : proposed) {
            context.validate();
            if (!identifiers.add(context.identifier())) {
                throw new IllegalArgumentException("Duplicate presentation context identifier " + context.identifier());
            }
        }
    }

    /** Assigns identifiers 1, 3, 5, ... to abstract/transfer syntax pairs in the given order. */
    public static List<PresentationContext> numbered(List<SupportedContext> requested) {
        if (requested.size() > MAX_CONTEXTS) {
            throw new IllegalArgumentException("At most " + MAX_CONTEXTS + " presentation contexts may be requested");
        }
        return IntStream.range(0, requested.size())
            .mapToObj(index -> new PresentationContext(
                2 * index + 1,
                requested.get(index).abstractSyntax(),
                requested.get(index).transferSyntaxes()))
            .toList();
    }
}
