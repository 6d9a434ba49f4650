package com.skilldeck.skills;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SkillDocumentTest {

    @Test
    void parsesFrontmatterAndBody() {
        var doc = SkillDocument.parse("""
                ---
                name: Meeting Prep
                description: Prepares a briefing
                triggers:
                  - meeting
                  - standup
                tools:
                  - calendar
                priority: 5
                maxTurns: 8
                ---

                # Meeting Prep

                Gather the agenda first.
                """).validate();

        assertEquals("Meeting Prep", doc.name());
        assertEquals("meeting-prep", doc.slug());
        assertEquals(List.of("meeting", "standup"), doc.triggers());
        assertEquals(List.of("calendar"), doc.tools());
        assertEquals(5, doc.priority());
        assertEquals(8, doc.maxTurns());
        assertEquals("# Meeting Prep\n\nGather the agenda first.", doc.body());

        var def = doc.toDefinition();
        assertEquals("meeting-prep", def.slug());
        assertEquals(8, def.ttlOverride());
        assertFalse(def.hasCapability());
    }

    @Test
    void acceptsCrlfLineEndings() {
        var doc = SkillDocument.parse("---\r\nname: Win\r\ndescription: d\r\n---\r\nbody").validate();
        assertEquals("Win", doc.name());
        assertEquals("body", doc.body());
    }

    @Test
    void optionalFieldsDefault() {
        var doc = SkillDocument.parse("---\nname: Min\ndescription: d\n---\n").validate();
        assertTrue(doc.triggers().isEmpty());
        assertTrue(doc.tools().isEmpty());
        assertEquals(0, doc.priority());
        assertEquals(0, doc.maxTurns());
        assertEquals("", doc.body());
    }

    @Test
    void rejectsMissingOpeningMarker() {
        var e = assertThrows(SkillException.class, () -> SkillDocument.parse("name: x\n"));
        assertEquals(SkillException.ErrorKind.VALIDATION_FAILED, e.kind());
    }

    @Test
    void rejectsMissingClosingMarker() {
        assertThrows(SkillException.class, () -> SkillDocument.parse("---\nname: x\ndescription: d\n"));
    }

    @Test
    void rejectsMalformedYaml() {
        assertThrows(SkillException.class, () -> SkillDocument.parse("---\nname: [unclosed\n---\nbody"));
    }

    @Test
    void rejectsScalarFrontmatter() {
        assertThrows(SkillException.class, () -> SkillDocument.parse("---\njust text\n---\nbody"));
    }

    @Test
    void rejectsNonIntegerPriority() {
        assertThrows(SkillException.class,
                () -> SkillDocument.parse("---\nname: x\ndescription: d\npriority: high\n---\n"));
    }

    @Test
    void validateRequiresNameAndDescription() {
        assertThrows(SkillException.class, () -> SkillDocument.parse("---\ndescription: d\n---\n").validate());
        assertThrows(SkillException.class, () -> SkillDocument.parse("---\nname: x\n---\n").validate());
        assertThrows(SkillException.class, () -> SkillDocument.parse("---\nname: '!!!'\ndescription: d\n---\n").validate());
    }

    @Test
    void slugify() {
        assertEquals("meeting-prep", SkillDocument.slugify("  Meeting Prep "));
        assertEquals("code-review", SkillDocument.slugify("code_review"));
        assertEquals("a-b", SkillDocument.slugify("a -- b"));
        assertEquals("caf", SkillDocument.slugify("Café!"));
        assertEquals("", SkillDocument.slugify("---"));
        assertEquals("", SkillDocument.slugify(null));
    }
}
