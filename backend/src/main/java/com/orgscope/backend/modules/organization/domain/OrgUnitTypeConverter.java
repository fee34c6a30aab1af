package com.orgscope.backend.modules.organization.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link OrgUnitType} as its lower-case tag.
 */
@Converter
public class OrgUnitTypeConverter implements AttributeConverter<OrgUnitType, String> {

    @Override
    public String convertToDatabaseColumn(OrgUnitType attribute) {
        return attribute == null ? null : attribute.tag();
    }

    @Override
    public OrgUnitType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : OrgUnitType.fromTag(dbData);
    }
}
