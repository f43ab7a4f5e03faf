package org.subtrack;

import org.springframework.beans.BeansException;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.admin.SpringApplicationAdminJmxAutoConfiguration;
import org.springframework.boot.autoconfigure.jmx.JmxAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.autoconfigure.ssl.SslAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.ReactiveMultipartAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.WebSessionIdResolverAutoConfiguration;
import org.springframework.boot.web.context.WebServerGracefulShutdownLifecycle;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.context.SmartLifecycle;
import org.subtrack.init.InitDB;

import lombok.extern.slf4j.Slf4j;

@SpringBootApplication(exclude = {
	JmxAutoConfiguration.class,
	ReactiveMultipartAutoConfiguration.class,
	SpringApplicationAdminJmxAutoConfiguration.class,
	SqlInitializationAutoConfiguration.class,
	SslAutoConfiguration.class,
	WebSessionIdResolverAutoConfiguration.class,
})
@Slf4j
public class SubtrackApp implements SmartLifecycle, ApplicationContextAware {

	public static void main(String[] args) {
		SpringApplication.run(SubtrackApp.class, args);
	}
	
	public void initApp() {
		InitDB init = new InitDB();
		context.getAutowireCapableBeanFactory().autowireBean(init);
		init.init();
		log.info(" ✔ Database ready");
	}

	private boolean running = false;
	private ApplicationContext context;
	
	@Override
	public void start() {
		initApp();
		running = true;
	}

	@Override
	public void stop() {
		running = false;
	}

	@Override
	public boolean isRunning() {
		return running;
	}
	
	@Override
	public int getPhase() {
		// WebServerStartStopLifecycle - 1 to do it before the web server is exposed
		return WebServerGracefulShutdownLifecycle.SMART_LIFECYCLE_PHASE - 1025;
	}

	@Override
	public void setApplicationContext(ApplicationContext applicationContext) throws BeansException {
		context = applicationContext;
	}
}
