package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the value types: windows, cursors, projected rows and rate limit state.
 */
@DisplayName("Data Models Tests")
class DataModelsTest {

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private final SearchWindow january = new SearchWindow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

	@Nested
	@DisplayName("SearchWindow")
	class SearchWindowTest {

		@Test
		@DisplayName("Should render the created qualifier with both dates inclusive")
		void shouldRenderQualifier() {
			assertThat(january.toCreatedQualifier()).isEqualTo("created:2024-01-01..2024-01-31");
			assertThat(january.widthInDays()).isEqualTo(30);
		}

		@Test
		@DisplayName("Should reject an end before the start")
		void shouldRejectInvertedRange() {
			assertThatThrownBy(() -> new SearchWindow(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)))
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("PageCursor")
	class PageCursorTest {

		@Test
		@DisplayName("Should start at page 1 and advance one page at a time")
		void shouldAdvance() {
			PageCursor cursor = PageCursor.first(january);

			assertThat(cursor.pageNumber()).isEqualTo(1);
			assertThat(cursor.next().pageNumber()).isEqualTo(2);
			assertThat(cursor.next().window()).isEqualTo(january);
		}

		@Test
		@DisplayName("Should stop at the page-depth ceiling")
		void shouldStopAtCeiling() {
			PageCursor last = new PageCursor(january, PageCursor.MAX_PAGES);

			assertThat(last.isLastPage()).isTrue();
			assertThatThrownBy(last::next).isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("Should reject page numbers outside 1..10")
		void shouldRejectOutOfRangePages() {
			assertThatThrownBy(() -> new PageCursor(january, 0)).isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new PageCursor(january, 11)).isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should visit exactly ten pages")
		void shouldVisitTenPages() {
			List<Integer> pages = new ArrayList<>();
			PageCursor cursor = PageCursor.first(january);
			pages.add(cursor.pageNumber());
			while (!cursor.isLastPage()) {
				cursor = cursor.next();
				pages.add(cursor.pageNumber());
			}

			assertThat(pages).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
		}

	}

	@Nested
	@DisplayName("RepositoryRecord")
	class RepositoryRecordTest {

		@Test
		@DisplayName("Should project the five fields from a full search item")
		void shouldProjectFields() throws Exception {
			JsonNode item = objectMapper.readTree("""
					{"id": 7, "name": "spring-ai", "full_name": "spring-projects/spring-ai",
					 "stargazers_count": 4200, "language": "Java", "created_at": "2023-06-01T12:00:00Z",
					 "forks": 900, "owner": {"login": "spring-projects"}}
					""");

			RepositoryRecord record = RepositoryRecord.fromSearchItem(item);

			assertThat(record).isEqualTo(new RepositoryRecord("spring-ai", "spring-projects/spring-ai", 4200, "Java",
					"2023-06-01T12:00:00Z"));
		}

		@Test
		@DisplayName("Should keep null and missing values as null")
		void shouldKeepNulls() throws Exception {
			JsonNode item = objectMapper.readTree("""
					{"name": "docs", "full_name": "owner/docs", "language": null}
					""");

			RepositoryRecord record = RepositoryRecord.fromSearchItem(item);

			assertThat(record.name()).isEqualTo("docs");
			assertThat(record.language()).isNull();
			assertThat(record.stargazersCount()).isNull();
			assertThat(record.createdAt()).isNull();
		}

	}

	@Nested
	@DisplayName("RateLimitInfo and GitHubResponse")
	class RateLimitTest {

		@Test
		@DisplayName("Should report unknown fields")
		void shouldReportUnknown() {
			RateLimitInfo unknown = RateLimitInfo.unknown();

			assertThat(unknown.hasRemaining()).isFalse();
			assertThat(unknown.hasReset()).isFalse();
		}

		@Test
		@DisplayName("Should expose the reset instant")
		void shouldExposeReset() {
			RateLimitInfo info = new RateLimitInfo(30, 12, 1_700_000_000L, 18);

			assertThat(info.hasRemaining()).isTrue();
			assertThat(info.getResetTime()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
		}

		@Test
		@DisplayName("Should classify 2xx as successful")
		void shouldClassifyStatus() {
			assertThat(new GitHubResponse("u", 200, "{}", RateLimitInfo.unknown()).isSuccessful()).isTrue();
			assertThat(new GitHubResponse("u", 204, "", RateLimitInfo.unknown()).isSuccessful()).isTrue();
			assertThat(new GitHubResponse("u", 304, "", RateLimitInfo.unknown()).isSuccessful()).isFalse();
			assertThat(new GitHubResponse("u", 500, "", RateLimitInfo.unknown()).isSuccessful()).isFalse();
		}

		@Test
		@DisplayName("Should recognise rate limit rejections")
		void shouldRecogniseRateLimitErrors() {
			assertThat(new GitHubApiException("x", 429, "").isRateLimitError()).isTrue();
			assertThat(new GitHubApiException("x", 403, "", 0, 1L).isRateLimitError()).isTrue();
			assertThat(new GitHubApiException("x", 403, "", 10, 1L).isRateLimitError()).isFalse();
		}

	}

}
