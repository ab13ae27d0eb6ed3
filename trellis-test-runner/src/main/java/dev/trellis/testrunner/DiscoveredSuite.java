package dev.trellis.testrunner;

import com.google.common.collect.ImmutableList;
import dev.trellis.testrunner.fixture.FixtureDef;
import dev.trellis.testrunner.item.TestItem;
import org.jetbrains.annotations.NotNull;

/**
 * Everything discovery produced: fixture definitions and test items, items in discovery order.
 */
public record DiscoveredSuite(
	@NotNull ImmutableList<FixtureDef> fixtures,
	@NotNull ImmutableList<TestItem> items
) {
	public static DiscoveredSuite of(Iterable<FixtureDef> fixtures, Iterable<TestItem> items) {
		return new DiscoveredSuite(ImmutableList.copyOf(fixtures), ImmutableList.copyOf(items));
	}
}
