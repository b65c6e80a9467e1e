package com.listing.reconciliation.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.listing.reconciliation.core.model.ChangePayload;
import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.CreatePayload;
import com.listing.reconciliation.core.model.DeletePayload;
import com.listing.reconciliation.core.model.MissingReferenceKind;
import com.listing.reconciliation.core.model.MissingReferencePayload;
import com.listing.reconciliation.core.model.TrackedField;
import com.listing.reconciliation.core.model.UnchangedPayload;
import com.listing.reconciliation.core.model.UpdatePayload;

/**
 * Encodes change payloads as JSON blobs and decodes them back into the payload type of the
 * change's {@link ChangeType}.
 *
 * <p>Decoding is strict: unknown properties, a blob of the wrong shape, or a payload that
 * violates its type's constraints fail with {@link InvalidPayloadException}. Property names
 * are snake_case.</p>
 */
public class ChangePayloadCodec {

    private final ObjectMapper objectMapper;

    public ChangePayloadCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public String encode(ChangePayload payload) {
        validate(payload);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException("Failed to encode " + payload.type() + " payload", e);
        }
    }

    public ChangePayload decode(ChangeType type, String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidPayloadException("Empty payload for " + type + " change");
        }
        ChangePayload payload;
        try {
            payload = objectMapper.readValue(json, payloadClass(type));
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException("Payload does not match " + type + " schema: "
                    + e.getOriginalMessage(), e);
        }
        validate(payload);
        return payload;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    static Class<? extends ChangePayload> payloadClass(ChangeType type) {
        return switch (type) {
            case CREATE -> CreatePayload.class;
            case UPDATE -> UpdatePayload.class;
            case DELETE -> DeletePayload.class;
            case UNCHANGED -> UnchangedPayload.class;
            case MISSING_REFERENCE -> MissingReferencePayload.class;
        };
    }

    /**
     * Checks the constraints the record constructors cannot express.
     */
    void validate(ChangePayload payload) {
        if (payload instanceof CreatePayload create) {
            if (create.refs().makeId() == null || create.refs().modelId() == null) {
                throw new InvalidPayloadException("Create payload requires make and model ids");
            }
        } else if (payload instanceof UpdatePayload update) {
            for (String field : update.fieldChanges().keySet()) {
                try {
                    TrackedField.fromFieldName(field);
                } catch (IllegalArgumentException e) {
                    throw new InvalidPayloadException("Update payload changes untracked field '" + field + "'", e);
                }
            }
        } else if (payload instanceof MissingReferencePayload missing) {
            if (missing.missing().kind() == MissingReferenceKind.MODEL && missing.missing().makeId() == null) {
                throw new InvalidPayloadException("Missing model reference requires the resolved make id");
            }
        }
    }
}
