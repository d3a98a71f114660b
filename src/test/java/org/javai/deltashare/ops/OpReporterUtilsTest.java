package org.javai.deltashare.ops;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class OpReporterUtilsTest {

	@Test
	void printable_escapesLineBreaks() {
		assertThat(OpReporterUtils.printable("https://a.cloud.databricks.com\r\nINFO forged entry"))
				.isEqualTo("https://a.cloud.databricks.com\\r\\nINFO forged entry");
	}

	@Test
	void printable_replacesOtherControlCharacters() {
		assertThat(OpReporterUtils.printable("a\u0000b\u001bc\td")).isEqualTo("a?b?c\\td");
	}

	@Test
	void printable_truncatesLongInput() {
		String printable = OpReporterUtils.printable("x".repeat(1000));

		assertThat(printable).hasSize(OpReporterUtils.MAX_PRINTABLE_LENGTH + 3).endsWith("...");
	}

	@Test
	void printable_leavesOrdinaryTextAlone() {
		assertThat(OpReporterUtils.printable("https://adb-1.2.azuredatabricks.net/?o=1"))
				.isEqualTo("https://adb-1.2.azuredatabricks.net/?o=1");
		assertThat(OpReporterUtils.printable(null)).isEqualTo("null");
	}
}
