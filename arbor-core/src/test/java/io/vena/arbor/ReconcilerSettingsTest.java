package io.vena.arbor;

import io.vena.arbor.ReconcilerSettings.FuzzyWeights;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconcilerSettingsTest {

	@Test
	void defaults() {
		ReconcilerSettings settings = ReconcilerSettings.defaults();
		assertEquals(55, settings.fuzzyThreshold());
		assertTrue(settings.namesContestExactMatches());
		FuzzyWeights weights = settings.weights();
		assertEquals(40, weights.type());
		assertEquals(25, weights.parent());
		assertEquals(15, weights.containingField());
		assertEquals(10, weights.name());
		assertEquals(10, weights.siblingIndex());
		assertEquals(100, weights.maximum());
		assertDoesNotThrow(settings::validate);
	}

	@Test
	void negativeWeight_rejected() {
		ReconcilerSettings settings = ReconcilerSettings.builder()
			.weights(FuzzyWeights.builder().parent(-1).build())
			.build();
		assertThrows(IllegalArgumentException.class, settings::validate);
	}

	@Test
	void nonPositiveThreshold_rejected() {
		assertThrows(IllegalArgumentException.class, () -> ReconcilerSettings.builder().fuzzyThreshold(0).build().validate());
		assertThrows(IllegalArgumentException.class, () -> ReconcilerSettings.builder().fuzzyThreshold(-5).build().validate());
	}

	@Test
	void missingGenerator_rejected() {
		ReconcilerSettings settings = ReconcilerSettings.builder().idGenerator(null).build();
		assertThrows(IllegalArgumentException.class, settings::validate);
	}
}
