package org.subtrack.init;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@SuppressWarnings("java:S6813") // use autowired instead of constructor
public class InitDB {

	@Autowired private R2dbcEntityTemplate db;
	
	private static final String[] TABLES = {
		"subscriptions"
	};
	
	public void init() {
		for (var table : TABLES) createTable(table);
	}
	
	private void createTable(String tableName) {
		log.info("Create table {}", tableName);
		String sql;
		try (InputStream in = InitDB.class.getClassLoader().getResourceAsStream("db_init/" + tableName + ".sql")) {
			if (in == null) throw new IllegalStateException("Missing resource db_init/" + tableName + ".sql");
			sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Cannot read script of table " + tableName, e);
		}
		db.getDatabaseClient().sql(sql).then()
		.doOnError(e -> log.error("Error creating table {}", tableName, e))
		.block();
	}
	
}
