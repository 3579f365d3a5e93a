package it.netdicom.pdu;

import java.util.List;

public record PresentationContextRqItem(int contextId, String abstractSyntax, List<String> transferSyntaxes) {

    public PresentationContextRqItem {
        transferSyntaxes = List.copyOf(transferSyntaxes);
    }
}
