package org.springaicommunity.github.harvester;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * A calendar range used to keep a single search query under the 1,000 result cap.
 *
 * @param startDate first creation date matched (inclusive)
 * @param endDate last creation date matched (inclusive)
 */
public record SearchWindow(LocalDate startDate, LocalDate endDate) {

	public SearchWindow {
		if (endDate.isBefore(startDate)) {
			throw new IllegalArgumentException("Window end " + endDate + " is before start " + startDate);
		}
	}

	/**
	 * Returns the GitHub search qualifier matching this window, e.g.
	 * {@code created:2014-01-01..2014-01-31}.
	 * @return the date range qualifier
	 */
	public String toCreatedQualifier() {
		return "created:" + startDate + ".." + endDate;
	}

	/**
	 * Days between start and end.
	 * @return the window width in days
	 */
	public long widthInDays() {
		return ChronoUnit.DAYS.between(startDate, endDate);
	}

	@Override
	public String toString() {
		return startDate + ".." + endDate;
	}

}
