package com.example.docaudit;

import com.example.docaudit.domain.model.LicenseAnchors;
import com.example.docaudit.domain.model.PersonalDataRuleSet;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest
class DocAuditApplicationTests {

	@Autowired
	private PersonalDataRuleSet ruleSet;

	@Autowired
	private LicenseAnchors anchors;

	/**
	 * Ensures the application context loads with the shared rule and anchor tables.
	 */
	@Test
	void contextLoads() {
		assertThat(ruleSet.rules()).hasSize(9);
		assertThat(anchors.expiry()).contains("caduc");
	}

}
