package com.opsdash.coordination.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import com.opsdash.coordination.model.ConditionGroupDto;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.List;

@Converter
public class ConditionGroupsJsonConverter implements AttributeConverter<List<ConditionGroupDto>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final CollectionType GROUPS_TYPE =
      MAPPER.getTypeFactory().constructCollectionType(List.class, ConditionGroupDto.class);

  @Override
  public String convertToDatabaseColumn(List<ConditionGroupDto> attribute) {
    try {
      return MAPPER.writeValueAsString(attribute == null ? List.of() : attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize condition groups", e);
    }
  }

  @Override
  public List<ConditionGroupDto> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return List.of();
    }
    try {
      return MAPPER.readValue(dbData, GROUPS_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to deserialize condition groups", e);
    }
  }
}
