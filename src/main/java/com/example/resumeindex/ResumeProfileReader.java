package com.example.resumeindex;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes loosely shaped extractor output into a {@link ResumeProfile}.
 * <p>
 * Scalars may arrive as text, numbers or booleans; {@code skills} may arrive as a bare list or as an
 * object. All of that is resolved here, once, so the rest of the code only sees the canonical shape.
 */
@Component
public class ResumeProfileReader {

    private final ObjectMapper mapper;

    public ResumeProfileReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ResumeProfile read(String profileJson) {
        if (profileJson == null) {
            throw new ValidationException("Profile payload is missing.");
        }
        JsonNode root;
        try {
            root = mapper.readTree(profileJson);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Profile payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return read(root);
    }

    public ResumeProfile read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ValidationException("Profile payload must be a JSON object.");
        }
        ResumeProfile profile = new ResumeProfile();
        profile.setPersonalInformation(readPersonalInformation(root.get("personal_information")));
        profile.setSkills(readSkills(root.get("skills")));
        profile.setExperience(readExperience(root.get("experience")));
        profile.setEducation(readEducation(root.get("education")));
        return profile;
    }

    public String toJson(ResumeProfile profile) {
        try {
            return mapper.writeValueAsString(profile);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Profile could not be serialized: " + e.getOriginalMessage(), e);
        }
    }

    private ResumeProfile.PersonalInformation readPersonalInformation(JsonNode node) {
        ResumeProfile.PersonalInformation info = new ResumeProfile.PersonalInformation();
        if (node == null || !node.isObject()) return info;
        info.setFullName(text(node.get("full_name")));
        info.setHeadline(text(node.get("headline")));
        info.setLocation(text(node.get("location")));
        info.setLinkedinUrl(text(node.get("linkedin_url")));
        return info;
    }

    private ResumeProfile.Skills readSkills(JsonNode node) {
        ResumeProfile.Skills skills = new ResumeProfile.Skills();
        if (node == null) return skills;
        if (node.isArray() || node.isValueNode()) {
            // bare list form: everything is a top skill
            skills.setTopSkills(textList(node));
        } else if (node.isObject()) {
            skills.setTopSkills(textList(node.get("top_skills")));
            skills.setLanguages(textList(node.get("languages")));
        }
        return skills;
    }

    private List<ResumeProfile.ExperienceEntry> readExperience(JsonNode node) {
        List<ResumeProfile.ExperienceEntry> out = new ArrayList<>();
        if (node == null || !node.isArray()) return out;
        for (JsonNode item : node) {
            if (!item.isObject()) continue;
            ResumeProfile.ExperienceEntry e = new ResumeProfile.ExperienceEntry();
            e.setCompany(text(item.get("company")));
            e.setTitle(text(item.get("title")));
            e.setStartDate(text(item.get("start_date")));
            e.setEndDate(text(item.get("end_date")));
            e.setDuration(text(item.get("duration")));
            e.setLocation(text(item.get("location")));
            e.setDescriptionBullets(textList(item.get("description_bullets")));
            out.add(e);
        }
        return out;
    }

    private List<ResumeProfile.EducationEntry> readEducation(JsonNode node) {
        List<ResumeProfile.EducationEntry> out = new ArrayList<>();
        if (node == null || !node.isArray()) return out;
        for (JsonNode item : node) {
            if (!item.isObject()) continue;
            ResumeProfile.EducationEntry e = new ResumeProfile.EducationEntry();
            e.setInstitution(text(item.get("institution")));
            e.setDegree(text(item.get("degree")));
            e.setFieldOfStudy(text(item.get("field_of_study")));
            e.setStartYear(text(item.get("start_year")));
            e.setEndYear(text(item.get("end_year")));
            out.add(e);
        }
        return out;
    }

    static String text(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) return null;
        String s = node.isTextual() ? node.textValue() : node.asText();
        if (s == null) return null;
        String trimmed = s.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) return out;
        if (node.isValueNode()) {
            String single = text(node);
            if (single != null) out.add(single);
            return out;
        }
        if (!node.isArray()) return out;
        for (JsonNode item : node) {
            String s = text(item);
            if (s != null) out.add(s);
        }
        return out;
    }
}
