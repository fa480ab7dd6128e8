package tuff.porter;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TranspilerConfigTest {
	@Test
	void addingKnownTypesKeepsTheDefaults() {
		TranspilerConfig config = TranspilerConfig.DEFAULT.withKnownExternalTypes(Set.of("Widget"));

		assertTrue(config.knownExternalTypes().contains("Widget"));
		assertTrue(config.knownExternalTypes().containsAll(TranspilerConfig.JAVA_LANG_TYPES));
		assertEquals(TranspilerConfig.DEFAULT.indent(), config.indent());
	}

	@Test
	void copiesChangeOneSetting() {
		TranspilerConfig config = TranspilerConfig.DEFAULT.withIndent("    ").withLineSeparator("\n");

		assertEquals("    ", config.indent());
		assertEquals("\n", config.lineSeparator());
		assertEquals(TranspilerConfig.DEFAULT.knownExternalTypes(), config.knownExternalTypes());
	}
}
