package it.netdicom.sop;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Static table of well-known SOP classes. Private or newer classes are added through {@link #register}.
 */
public final class SopClassRegistry {

    public static final String VERIFICATION = "1.2.840.10008.1.1";
    public static final String CT_IMAGE_STORAGE = "1.2.840.10008.5.1.4.1.1.2";
    public static final String MR_IMAGE_STORAGE = "1.2.840.10008.5.1.4.1.1.4";
    public static final String SECONDARY_CAPTURE_IMAGE_STORAGE = "1.2.840.10008.5.1.4.1.1.7";
    public static final String PATIENT_ROOT_FIND = "1.2.840.10008.5.1.4.1.2.1.1";
    public static final String PATIENT_ROOT_MOVE = "1.2.840.10008.5.1.4.1.2.1.2";
    public static final String PATIENT_ROOT_GET = "1.2.840.10008.5.1.4.1.2.1.3";
    public static final String STUDY_ROOT_FIND = "1.2.840.10008.5.1.4.1.2.2.1";
    public static final String STUDY_ROOT_MOVE = "1.2.840.10008.5.1.4.1.2.2.2";
    public static final String STUDY_ROOT_GET = "1.2.840.10008.5.1.4.1.2.2.3";
    public static final String MODALITY_WORKLIST_FIND = "1.2.840.10008.5.1.4.31";
    public static final String STORAGE_COMMITMENT_PUSH = "1.2.840.10008.1.20.1";
    public static final String MODALITY_PERFORMED_PROCEDURE_STEP = "1.2.840.10008.3.1.2.3.3";

    private static final Map<String, SopClass> BY_NAME = new ConcurrentHashMap<>();
    private static final Map<String, SopClass> BY_UID = new ConcurrentHashMap<>();

    static {
        register("VerificationSOPClass", VERIFICATION, ServiceKind.VERIFICATION);

        register("ComputedRadiographyImageStorage", "1.2.840.10008.5.1.4.1.1.1", ServiceKind.STORAGE);
        register("DigitalXRayImageStorageForPresentation", "1.2.840.10008.5.1.4.1.1.1.1", ServiceKind.STORAGE);
        register("DigitalMammographyXRayImageStorageForPresentation", "1.2.840.10008.5.1.4.1.1.1.2", ServiceKind.STORAGE);
        register("CTImageStorage", CT_IMAGE_STORAGE, ServiceKind.STORAGE);
        register("EnhancedCTImageStorage", "1.2.840.10008.5.1.4.1.1.2.1", ServiceKind.STORAGE);
        register("UltrasoundMultiFrameImageStorage", "1.2.840.10008.5.1.4.1.1.3.1", ServiceKind.STORAGE);
        register("MRImageStorage", MR_IMAGE_STORAGE, ServiceKind.STORAGE);
        register("EnhancedMRImageStorage", "1.2.840.10008.5.1.4.1.1.4.1", ServiceKind.STORAGE);
        register("UltrasoundImageStorage", "1.2.840.10008.5.1.4.1.1.6.1", ServiceKind.STORAGE);
        register("SecondaryCaptureImageStorage", SECONDARY_CAPTURE_IMAGE_STORAGE, ServiceKind.STORAGE);
        register("XRayAngiographicImageStorage", "1.2.840.10008.5.1.4.1.1.12.1", ServiceKind.STORAGE);
        register("NuclearMedicineImageStorage", "1.2.840.10008.5.1.4.1.1.20", ServiceKind.STORAGE);
        register("PositronEmissionTomographyImageStorage", "1.2.840.10008.5.1.4.1.1.128", ServiceKind.STORAGE);
        register("RTImageStorage", "1.2.840.10008.5.1.4.1.1.481.1", ServiceKind.STORAGE);
        register("RTDoseStorage", "1.2.840.10008.5.1.4.1.1.481.2", ServiceKind.STORAGE);
        register("RTStructureSetStorage", "1.2.840.10008.5.1.4.1.1.481.3", ServiceKind.STORAGE);
        register("RTPlanStorage", "1.2.840.10008.5.1.4.1.1.481.5", ServiceKind.STORAGE);
        register("BasicTextSRStorage", "1.2.840.10008.5.1.4.1.1.88.11", ServiceKind.STORAGE);
        register("EnhancedSRStorage", "1.2.840.10008.5.1.4.1.1.88.22", ServiceKind.STORAGE);
        register("EncapsulatedPDFStorage", "1.2.840.10008.5.1.4.1.1.104.1", ServiceKind.STORAGE);
        register("VLWholeSlideMicroscopyImageStorage", "1.2.840.10008.5.1.4.1.1.77.1.6", ServiceKind.STORAGE);

        register("PatientRootQueryRetrieveInformationModelFind", PATIENT_ROOT_FIND, ServiceKind.QUERY_RETRIEVE);
        register("PatientRootQueryRetrieveInformationModelMove", PATIENT_ROOT_MOVE, ServiceKind.QUERY_RETRIEVE);
        register("PatientRootQueryRetrieveInformationModelGet", PATIENT_ROOT_GET, ServiceKind.QUERY_RETRIEVE);
        register("StudyRootQueryRetrieveInformationModelFind", STUDY_ROOT_FIND, ServiceKind.QUERY_RETRIEVE);
        register("StudyRootQueryRetrieveInformationModelMove", STUDY_ROOT_MOVE, ServiceKind.QUERY_RETRIEVE);
        register("StudyRootQueryRetrieveInformationModelGet", STUDY_ROOT_GET, ServiceKind.QUERY_RETRIEVE);
        register("ModalityWorklistInformationFind", MODALITY_WORKLIST_FIND, ServiceKind.QUERY_RETRIEVE);

        register("StorageCommitmentPushModel", STORAGE_COMMITMENT_PUSH, ServiceKind.NORMALIZED);
        register("ModalityPerformedProcedureStep", MODALITY_PERFORMED_PROCEDURE_STEP, ServiceKind.NORMALIZED);
        register("BasicFilmSession", "1.2.840.10008.5.1.1.1", ServiceKind.NORMALIZED);
        register("BasicFilmBox", "1.2.840.10008.5.1.1.2", ServiceKind.NORMALIZED);
        register("PrinterSOPClass", "1.2.840.10008.5.1.1.16", ServiceKind.NORMALIZED);
        register("InstanceAvailabilityNotification", "1.2.840.10008.5.1.4.33", ServiceKind.NORMALIZED);
    }

    private SopClassRegistry() {
    }

    public static SopClass register(String name, String uid, ServiceKind serviceKind) {
        SopClass sopClass = new SopClass(name, uid, serviceKind);
        SopClass existing = BY_UID.get(uid);
        if (existing != null && !existing.name().equals(name)) {
            throw new IllegalArgumentException("UID " + uid + " is already registered as " + existing.name());
        }
        BY_NAME.put(name, sopClass);
        BY_UID.put(uid, sopClass);
        return sopClass;
    }

    public static Optional<SopClass> byUid(String uid) {
        return Optional.ofNullable(uid).map(BY_UID::get);
    }

    public static Optional<SopClass> byName(String name) {
        return Optional.ofNullable(name).map(BY_NAME::get);
    }

    public static String nameOf(String uid) {
        return byUid(uid).map(SopClass::name).orElse(uid);
    }

    public static List<SopClass> byServiceKind(ServiceKind serviceKind) {
        List<SopClass> result = new ArrayList<>();
        for (SopClass sopClass : BY_UID.values()) {
            if (sopClass.serviceKind() == serviceKind) {
                result.add(sopClass);
            }
        }
        result.sort((a, b) -> a.name().compareTo(b.name()));
        return result;
    }
}
