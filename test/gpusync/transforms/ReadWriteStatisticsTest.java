package gpusync.transforms;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import gpusync.hir.Buffer;

public class ReadWriteStatisticsTest {

	@Test
	public void reportsBuffersBothReadAndWritten() {
		Buffer a = new Buffer("A", "float32");
		Buffer b = new Buffer("B", "float32");
		Buffer c = new Buffer("C", "float32");
		ReadWriteStatistics stats = new ReadWriteStatistics();
		stats.addWrite(b);
		stats.addRead(a);
		stats.addRead(b);
		stats.addWrite(c);
		stats.addWrite(c);
		stats.addRead(c);

		assertEquals(Arrays.asList(b, c), stats.getReadWriteBuffers());
		assertEquals(2, stats.getWriteCount(c));
		assertEquals(0, stats.getWriteCount(a));

		stats.reset();
		assertTrue(stats.isEmpty());
		assertTrue(stats.getReadWriteBuffers().isEmpty());
	}
}
