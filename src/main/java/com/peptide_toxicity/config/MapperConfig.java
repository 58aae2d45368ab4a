package com.peptide_toxicity.config;

import com.peptide_toxicity.dto.history.SearchResultDTO;
import com.peptide_toxicity.entity.Prediction;
import org.modelmapper.ModelMapper;
import org.modelmapper.TypeMap;
import org.modelmapper.config.Configuration.AccessLevel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MapperConfig {
    @Bean
    public ModelMapper modelMapper() {
        ModelMapper modelMapper = new ModelMapper();

        modelMapper.getConfiguration()
                .setFieldMatchingEnabled(true)
                .setFieldAccessLevel(AccessLevel.PRIVATE)
                .setSkipNullEnabled(true)
                .setAmbiguityIgnored(true);

        TypeMap<Prediction, SearchResultDTO> typeMap = modelMapper.createTypeMap(Prediction.class, SearchResultDTO.class);
        typeMap.addMappings(mapper -> mapper.map(Prediction::getCreatedAt, SearchResultDTO::setTimestamp));

        return modelMapper;
    }
}
