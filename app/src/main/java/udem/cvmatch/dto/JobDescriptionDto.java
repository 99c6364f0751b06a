package udem.cvmatch.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobDescriptionDto(
        String title,
        @JsonProperty("required_skills")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        List<String> requiredSkills,
        @JsonProperty("preferred_skills")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        List<String> preferredSkills,
        @JsonProperty("tools_and_frameworks")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        List<String> toolsAndFrameworks
) {
    public JobDescriptionDto {
        requiredSkills = requiredSkills == null ? List.of() : requiredSkills;
        preferredSkills = preferredSkills == null ? List.of() : preferredSkills;
        toolsAndFrameworks = toolsAndFrameworks == null ? List.of() : toolsAndFrameworks;
    }
}
