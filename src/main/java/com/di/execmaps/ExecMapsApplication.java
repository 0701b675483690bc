package com.di.execmaps;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Shard DataSources are created by {@link com.di.execmaps.config.PersistenceConfiguration};
 * Spring Boot's single-DataSource auto-configuration is switched off.
 */
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@EnableAspectJAutoProxy
public class ExecMapsApplication {

	public static void main(String[] args) {
		SpringApplication.run(ExecMapsApplication.class, args);
	}
}
