/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.commandeer;

import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.commandeer.JdbcProxies.createInMemoryDataSource;
import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class BinaryStreamTests {
	@Test
	public void testStreamsColumnInChunks() {
		byte[] body = new byte[100_000];
		new Random(42).nextBytes(body);

		DataSource dataSource = createDocumentDataSource("testStreamsColumnInChunks", body);
		List<Integer> writeSizes = new ArrayList<>();
		ByteArrayOutputStream copy = new ByteArrayOutputStream();

		OutputStream outputStream = new OutputStream() {
			@Override
			public void write(int b) {
				writeSizes.add(1);
				copy.write(b);
			}

			@Override
			public void write(byte[] bytes, int offset, int length) {
				writeSizes.add(length);
				copy.write(bytes, offset, length);
			}
		};

		try (Commandeer commandeer = Commandeer.withDataSource(dataSource).build()) {
			long bytesCopied = commandeer.createTextCommand("select document_id, body from document where document_id = @id")
					.addParameter("id", 1)
					.executeBinaryStream("body", outputStream, 4096);

			Assertions.assertEquals(body.length, bytesCopied);
			Assertions.assertArrayEquals(body, copy.toByteArray());
			Assertions.assertTrue(writeSizes.stream().allMatch(writeSize -> writeSize <= 4096));
			Assertions.assertEquals(25, writeSizes.size());
			Assertions.assertEquals(ConnectionState.OPEN, commandeer.getConnectionState(),
					"Binary streaming leaves the connection open");
		}
	}

	@Test
	public void testMissingRowAndNullValueCopyNothing() {
		DataSource dataSource = createDocumentDataSource("testMissingRowAndNullValueCopyNothing", null);

		try (Commandeer commandeer = Commandeer.withDataSource(dataSource).build()) {
			ByteArrayOutputStream outputStream = new ByteArrayOutputStream();

			Assertions.assertEquals(0L, commandeer.createTextCommand("select body from document where document_id = -1")
					.executeBinaryStream("body", outputStream));
			Assertions.assertEquals(0L, commandeer.createTextCommand("select body from document")
					.executeBinaryStream("body", outputStream));
			Assertions.assertEquals(0, outputStream.size());
		}
	}

	@Test
	public void testWriteFailuresAreUnchecked() {
		DataSource dataSource = createDocumentDataSource("testWriteFailuresAreUnchecked", new byte[]{1, 2, 3});

		OutputStream outputStream = new OutputStream() {
			@Override
			public void write(int b) throws IOException {
				throw new IOException("disk full");
			}
		};

		try (Commandeer commandeer = Commandeer.withDataSource(dataSource).build()) {
			commandeer.createTextCommand("select body from document");

			UncheckedIOException e = Assertions.assertThrows(UncheckedIOException.class, () ->
					commandeer.executeBinaryStream("body", outputStream));

			Assertions.assertEquals("disk full", e.getCause().getMessage());
			Assertions.assertThrows(IllegalArgumentException.class, () ->
					commandeer.executeBinaryStream("body", new ByteArrayOutputStream(), 0));
		}
	}

	@NonNull
	protected DataSource createDocumentDataSource(@NonNull String databaseName,
																								byte[] body) {
		requireNonNull(databaseName);

		DataSource dataSource = createInMemoryDataSource(databaseName);

		try (Commandeer commandeer = Commandeer.withDataSource(dataSource).build()) {
			commandeer.createTextCommand("CREATE TABLE document (document_id INT, body VARBINARY(200000))").executeNonQuery();

			Map<String, Object> fields = new LinkedHashMap<>();
			fields.put("document_id", 1);
			fields.put("body", body);

			commandeer.createInsertCommand("document", fields).executeNonQuery();
		}

		return dataSource;
	}
}
