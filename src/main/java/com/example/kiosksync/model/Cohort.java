package com.example.kiosksync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Cohort implements SyncEntity {
    private String id;
    private String name;
    private String description;
    private String caseId;
    private String caseName;
    private String professorId;
    private String professorName;
    private String accessCode;
    private Integer maxDays;
    private LocalDate startDate;
    private LocalDate endDate;
    private List<Student> students;
    private CohortMode cohortMode;
    @JsonProperty("isActive")
    private Boolean active;
    private Boolean published;

    private String createdBy;
    private Instant createdAt;
    private String lastEditedBy;
    private Instant lastEditedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Student {
        private String email;
        private String name;
        private Instant joinedAt;
        private StudentStatus status;
    }

    public enum StudentStatus {
        @JsonProperty("invited") INVITED,
        @JsonProperty("joined") JOINED,
        @JsonProperty("active") ACTIVE,
        @JsonProperty("completed") COMPLETED
    }
}
