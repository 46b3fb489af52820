/*
 * どこで: Assignment アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: ConfigurationProperties レコードをまとめて有効化するため
 */
package com.taskmeister.assignment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskmeisterApplication {

	public static void main(String[] args) {
		SpringApplication.run(TaskmeisterApplication.class, args);
	}
}
