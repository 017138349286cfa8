package me.golemcore.gaplens.domain.stage;

import me.golemcore.gaplens.port.outbound.DataProviderPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SkillCatalogTest {

    private SkillCatalog skillCatalog;

    @BeforeEach
    void setUp() {
        DataProviderPort dataProvider = mock(DataProviderPort.class);
        when(dataProvider.getKnownSkills())
                .thenReturn(List.of("React", "React Native", "Java", "JavaScript", "CI/CD", "Node.js", "Go"));
        skillCatalog = new SkillCatalog(dataProvider);
    }

    @Test
    void shouldExtractCanonicalSkillsInOrderOfAppearance() {
        List<String> skills = skillCatalog.extractSkills("Do we have java and REACT people?");

        assertEquals(List.of("Java", "React"), skills);
    }

    @Test
    void shouldPreferLongerSkillNames() {
        List<String> skills = skillCatalog.extractSkills("Who can build React Native apps in JavaScript?");

        assertEquals(List.of("React Native", "JavaScript"), skills);
    }

    @Test
    void shouldRespectWordBoundaries() {
        assertEquals(List.of(), skillCatalog.extractSkills("Going to the reactor"));
        assertEquals(List.of("Go"), skillCatalog.extractSkills("Need Go, fast"));
    }

    @Test
    void shouldMatchSkillsWithPunctuation() {
        assertEquals(List.of("CI/CD", "Node.js"), skillCatalog.extractSkills("ci/cd pipelines for node.js"));
    }

    @Test
    void shouldReturnEmptyForBlankText() {
        assertEquals(List.of(), skillCatalog.extractSkills("   "));
        assertEquals(List.of(), skillCatalog.extractSkills(null));
    }

    @Test
    void shouldCanonicalizeIgnoringCase() {
        assertEquals(Optional.of("React"), skillCatalog.canonicalize(" react "));
        assertEquals(Optional.empty(), skillCatalog.canonicalize("Cobol"));
    }

    @Test
    void keyOfShouldProduceStorageSafeKeys() {
        assertEquals("ci-cd", SkillCatalog.keyOf("CI/CD"));
        assertEquals("node-js", SkillCatalog.keyOf("Node.js"));
        assertEquals("react-native", SkillCatalog.keyOf("React Native"));
        assertEquals("c", SkillCatalog.keyOf("C++"));
    }
}
