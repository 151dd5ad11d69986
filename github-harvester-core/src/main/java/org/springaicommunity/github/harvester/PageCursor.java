package org.springaicommunity.github.harvester;

/**
 * Position of the next page to request inside a {@link SearchWindow}.
 *
 * @param window the window being paginated
 * @param pageNumber 1-based page number, never above {@link #MAX_PAGES}
 */
public record PageCursor(SearchWindow window, int pageNumber) {

	/**
	 * Number of pages GitHub lets a single search enumerate (10 x 100 = 1,000 results).
	 */
	public static final int MAX_PAGES = 10;

	public PageCursor {
		if (pageNumber < 1 || pageNumber > MAX_PAGES) {
			throw new IllegalArgumentException("Page number must be between 1 and " + MAX_PAGES + ": " + pageNumber);
		}
	}

	/**
	 * Cursor for the first page of a window.
	 * @param window the window
	 * @return cursor at page 1
	 */
	public static PageCursor first(SearchWindow window) {
		return new PageCursor(window, 1);
	}

	public boolean isLastPage() {
		return pageNumber == MAX_PAGES;
	}

	/**
	 * Cursor for the following page.
	 * @return cursor at {@code pageNumber + 1}
	 * @throws IllegalStateException if this is already the last enumerable page
	 */
	public PageCursor next() {
		if (isLastPage()) {
			throw new IllegalStateException("No page after " + MAX_PAGES + " in window " + window);
		}
		return new PageCursor(window, pageNumber + 1);
	}

}
