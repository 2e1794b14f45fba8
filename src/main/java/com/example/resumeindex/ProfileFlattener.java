package com.example.resumeindex;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects a profile onto the newline-delimited text that gets embedded.
 * <p>
 * Output is a pure function of the profile: sections appear in a fixed order, list order is kept as
 * given, and absent parts are skipped. A profile with nothing usable flattens to {@code ""}; callers
 * decide whether that is an error.
 */
@Component
public class ProfileFlattener {

    private final ResumeProfileReader reader;

    public ProfileFlattener(ResumeProfileReader reader) {
        this.reader = reader;
    }

    public String flatten(String profileJson) {
        return flatten(reader.read(profileJson));
    }

    public String flatten(ResumeProfile profile) {
        List<String> lines = new ArrayList<>();
        if (profile == null) return "";

        ResumeProfile.PersonalInformation info = profile.getPersonalInformation();
        if (info != null) {
            if (present(info.getFullName())) lines.add("Full Name: " + info.getFullName().trim());
            if (present(info.getHeadline())) lines.add("Headline: " + info.getHeadline().trim());
        }

        ResumeProfile.Skills skills = profile.getSkills();
        if (skills != null) {
            List<String> top = nonBlank(skills.getTopSkills());
            if (!top.isEmpty()) lines.add("Skills: " + String.join(", ", top));
        }

        List<String> experienceLines = new ArrayList<>();
        if (profile.getExperience() != null) {
            for (ResumeProfile.ExperienceEntry e : profile.getExperience()) {
                if (e == null) continue;
                List<String> parts = new ArrayList<>();
                if (present(e.getCompany())) parts.add(e.getCompany().trim());
                if (present(e.getTitle())) parts.add(e.getTitle().trim());
                String range = range(e.getStartDate(), e.getEndDate());
                if (range != null) parts.add(range);
                List<String> bullets = nonBlank(e.getDescriptionBullets());
                if (!bullets.isEmpty()) parts.add(String.join("; ", bullets));
                if (!parts.isEmpty()) experienceLines.add("- " + String.join(" | ", parts));
            }
        }
        if (!experienceLines.isEmpty()) {
            lines.add("Experience:");
            lines.addAll(experienceLines);
        }

        List<String> educationLines = new ArrayList<>();
        if (profile.getEducation() != null) {
            for (ResumeProfile.EducationEntry e : profile.getEducation()) {
                if (e == null) continue;
                List<String> parts = new ArrayList<>();
                if (present(e.getInstitution())) parts.add(e.getInstitution().trim());
                String degree = degree(e.getDegree(), e.getFieldOfStudy());
                if (degree != null) parts.add(degree);
                String range = range(e.getStartYear(), e.getEndYear());
                if (range != null) parts.add(range);
                if (!parts.isEmpty()) educationLines.add("- " + String.join(" | ", parts));
            }
        }
        if (!educationLines.isEmpty()) {
            lines.add("Education:");
            lines.addAll(educationLines);
        }

        return String.join("\n", lines);
    }

    private static String degree(String degree, String field) {
        boolean hasDegree = present(degree);
        boolean hasField = present(field);
        if (hasDegree && hasField) return degree.trim() + " in " + field.trim();
        if (hasDegree) return degree.trim();
        if (hasField) return field.trim();
        return null;
    }

    private static String range(String start, String end) {
        if (!present(start) && !present(end)) return null;
        return (present(start) ? start.trim() : "Unknown") + " - " + (present(end) ? end.trim() : "Present");
    }

    private static List<String> nonBlank(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) return out;
        for (String v : values) {
            if (present(v)) out.add(v.trim());
        }
        return out;
    }

    private static boolean present(String s) {
        return s != null && !s.isBlank();
    }
}
