package com.example.resumeindex;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical shape of a stored resume payload. Instances are produced by {@link ResumeProfileReader},
 * so string fields are either trimmed non-blank text or null and list fields are never null.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.ALWAYS)
public class ResumeProfile {

    private PersonalInformation personalInformation = new PersonalInformation();
    private Skills skills = new Skills();
    private List<ExperienceEntry> experience = new ArrayList<>();
    private List<EducationEntry> education = new ArrayList<>();

    public PersonalInformation getPersonalInformation() { return personalInformation; }
    public void setPersonalInformation(PersonalInformation personalInformation) { this.personalInformation = personalInformation; }
    public Skills getSkills() { return skills; }
    public void setSkills(Skills skills) { this.skills = skills; }
    public List<ExperienceEntry> getExperience() { return experience; }
    public void setExperience(List<ExperienceEntry> experience) { this.experience = experience; }
    public List<EducationEntry> getEducation() { return education; }
    public void setEducation(List<EducationEntry> education) { this.education = education; }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class PersonalInformation {
        private String fullName;
        private String headline;
        private String location;
        private String linkedinUrl;

        public String getFullName() { return fullName; }
        public void setFullName(String fullName) { this.fullName = fullName; }
        public String getHeadline() { return headline; }
        public void setHeadline(String headline) { this.headline = headline; }
        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
        public String getLinkedinUrl() { return linkedinUrl; }
        public void setLinkedinUrl(String linkedinUrl) { this.linkedinUrl = linkedinUrl; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Skills {
        private List<String> topSkills = new ArrayList<>();
        private List<String> languages = new ArrayList<>();

        public List<String> getTopSkills() { return topSkills; }
        public void setTopSkills(List<String> topSkills) { this.topSkills = topSkills; }
        public List<String> getLanguages() { return languages; }
        public void setLanguages(List<String> languages) { this.languages = languages; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ExperienceEntry {
        private String company;
        private String title;
        private String startDate;
        private String endDate;
        private String duration;
        private String location;
        private List<String> descriptionBullets = new ArrayList<>();

        public String getCompany() { return company; }
        public void setCompany(String company) { this.company = company; }
        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }
        public String getStartDate() { return startDate; }
        public void setStartDate(String startDate) { this.startDate = startDate; }
        public String getEndDate() { return endDate; }
        public void setEndDate(String endDate) { this.endDate = endDate; }
        public String getDuration() { return duration; }
        public void setDuration(String duration) { this.duration = duration; }
        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
        public List<String> getDescriptionBullets() { return descriptionBullets; }
        public void setDescriptionBullets(List<String> descriptionBullets) { this.descriptionBullets = descriptionBullets; }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class EducationEntry {
        private String institution;
        private String degree;
        private String fieldOfStudy;
        private String startYear;
        private String endYear;

        public String getInstitution() { return institution; }
        public void setInstitution(String institution) { this.institution = institution; }
        public String getDegree() { return degree; }
        public void setDegree(String degree) { this.degree = degree; }
        public String getFieldOfStudy() { return fieldOfStudy; }
        public void setFieldOfStudy(String fieldOfStudy) { this.fieldOfStudy = fieldOfStudy; }
        public String getStartYear() { return startYear; }
        public void setStartYear(String startYear) { this.startYear = startYear; }
        public String getEndYear() { return endYear; }
        public void setEndYear(String endYear) { this.endYear = endYear; }
    }
}
