package org.subtrack.test;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.SpringBootTest.WebEnvironment;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.restassured.RestAssured;
import io.restassured.config.ObjectMapperConfig;
import io.restassured.config.RestAssuredConfig;

@SpringBootTest(webEnvironment = WebEnvironment.RANDOM_PORT)
@TestPropertySource(properties = {
	"spring.r2dbc.username=postgres",
	"spring.r2dbc.password=postgres",
	"subtrack.subscriptions.store-timeout=10s",
})
public abstract class AbstractTest {
	
	@SuppressWarnings("resource")
	static PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:16-alpine").withUsername("postgres").withPassword("postgres").withDatabaseName("subtrack");
	
	private static synchronized void start() {
		if (!postgreSQLContainer.isRunning()) postgreSQLContainer.start();
	}

	@LocalServerPort
	private Integer port;
	
	@Autowired
	private ObjectMapper objectMapper;
	
	@BeforeEach
	void setupRestAssured() {
		RestAssured.port = port;
		RestAssured.config = RestAssuredConfig.config().objectMapperConfig(
			ObjectMapperConfig.objectMapperConfig().jackson2ObjectMapperFactory((type, charset) -> objectMapper)
		);
	}
	
	@DynamicPropertySource
	static void postgreSQLProperties(DynamicPropertyRegistry registry) {
		start();
		registry.add("spring.r2dbc.url", () -> "r2dbc:postgresql://" + postgreSQLContainer.getHost() + ":" + postgreSQLContainer.getMappedPort(5432) + "/subtrack");
	}
	
}
