package it.netdicom.api;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import it.netdicom.acse.ExtendedNegotiation;
import it.netdicom.acse.Rejection;
import it.netdicom.association.ApplicationEntity;
import it.netdicom.association.Association;
import it.netdicom.dimse.CommandField;
import it.netdicom.dimse.DimseMessage;
import it.netdicom.dimse.Status;
import it.netdicom.dimse.StatusCategory;
import it.netdicom.presentation.NegotiatedContext;
import it.netdicom.presentation.PresentationContext;
import it.netdicom.sop.SopClassRegistry;
import it.netdicom.sop.TransferSyntax;
import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/dicom")
public class DicomController {

    private static final Logger logger = LoggerFactory.getLogger(DicomController.class);

    private final ApplicationEntity ae;

    public DicomController(ApplicationEntity ae) {
        this.ae = ae;
    }

    @GetMapping("/associations")
    public List<AssociationSummary> associations() {
        return ae.activeAssociations().stream().map(this::toSummary).toList();
    }

    @GetMapping("/capabilities")
    public CapabilityResponse capabilities() {
        List<CapabilityResponse.SupportedSopClass> contexts = ae.supportedContexts().stream()
            .map(context -> new CapabilityResponse.SupportedSopClass(
                SopClassRegistry.nameOf(context.abstractSyntax()), context.abstractSyntax(), context.transferSyntaxes()))
            .toList();
        Map<String, Set<String>> services = new LinkedHashMap<>();
        ae.services().capabilities().forEach((name, requests) -> {
            Set<String> operations = new LinkedHashSet<>();
            requests.stream().map(CommandField::operation).forEach(operations::add);
            services.put(name, operations);
        });
        return new CapabilityResponse(
            ae.aeTitle(),
            ae.settings().getMaxPduLength(),
            ae.settings().getMaxAssociations(),
            contexts,
            services
        );
    }

    /** Opens an association proposing only Verification, sends one C-ECHO and releases. */
    @PostMapping("/echo")
    public EchoResponse echo(@Valid @RequestBody EchoRequest request) {
        PresentationContext verification = new PresentationContext(1, SopClassRegistry.VERIFICATION,
            List.of(TransferSyntax.IMPLICIT_VR_LITTLE_ENDIAN, TransferSyntax.EXPLICIT_VR_LITTLE_ENDIAN));
        Association association;
        try {
            association = ae.associate(request.host(), request.port(), request.calledAeTitle(),
                List.of(verification), ExtendedNegotiation.NONE);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        if (!association.isEstablished()) {
            String detail = association.rejection().map(Rejection::describe).orElse("association not established");
            logger.info("C-ECHO to {} at {}:{} failed: {}", request.calledAeTitle(), request.host(), request.port(), detail);
            return new EchoResponse(request.calledAeTitle(), association.status().name(), null, null, detail);
        }
        try {
            DimseMessage response = association.sendEcho();
            int status = response.command().status();
            StatusCategory category = StatusCategory.of(status);
            return new EchoResponse(request.calledAeTitle(), association.status().name(), Status.hex(status), category.name(), null);
        } catch (IllegalStateException e) {
            logger.warn("C-ECHO to {} failed: {}", request.calledAeTitle(), e.getMessage());
            return new EchoResponse(request.calledAeTitle(), association.status().name(), null, null, e.getMessage());
        } finally {
            if (association.isEstablished()) {
                association.release();
            }
        }
    }

    private AssociationSummary toSummary(Association association) {
        return new AssociationSummary(
            association.id(),
            association.name(),
            association.isRequestor() ? "requestor" : "acceptor",
            association.localAeTitle(),
            association.peerAeTitle(),
            String.valueOf(association.peerAddress()),
            association.status().name(),
            association.state().label(),
            association.acceptedContexts().stream()
                .map(NegotiatedContext::abstractSyntax)
                .map(SopClassRegistry::nameOf)
                .toList()
        );
    }
}
