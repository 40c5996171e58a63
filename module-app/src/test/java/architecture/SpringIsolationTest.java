package architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Spring framework isolation tests.
 *
 * <p><strong>Core Principle:</strong> the escrow engine (module-core) must stay framework-agnostic
 * so that state transitions, fee math and the registry can be tested and reused without a Spring
 * context. Spring, Micrometer and web concerns belong in module-infra and module-app.
 */
@DisplayName("Spring Framework Isolation Tests")
class SpringIsolationTest {

  private final JavaClasses classes =
      new ClassFileImporter()
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_JARS)
          .importPackages("crowd.ledger");

  @Nested
  @DisplayName("Core Module: Framework-Agnostic Enforcement")
  class CoreModuleSpringFreeTests {

    @Test
    @DisplayName("Core should not use Spring annotations")
    void coreShouldNotUseSpringAnnotations() {
      noClasses()
          .that()
          .resideInAPackage("crowd.ledger.core..")
          .or()
          .resideInAPackage("crowd.ledger.domain..")
          .should()
          .beMetaAnnotatedWith("org.springframework..")
          .because(
              """
                            Core module must be Spring-free.
                            Spring annotations create framework coupling.
                            """)
          .allowEmptyShould(true)
          .check(classes);
    }

    @Test
    @DisplayName("Core should not depend on Spring Framework classes")
    void coreShouldNotDependOnSpringFramework() {
      noClasses()
          .that()
          .resideInAPackage("crowd.ledger.core..")
          .or()
          .resideInAPackage("crowd.ledger.domain.model..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("org.springframework.context..")
          .orShould()
          .dependOnClassesThat()
          .resideInAPackage("org.springframework.boot..")
          .orShould()
          .dependOnClassesThat()
          .resideInAPackage("org.springframework.stereotype..")
          .orShould()
          .dependOnClassesThat()
          .resideInAPackage("org.springframework.web..")
          .because(
              """
                            Core module must be framework-agnostic.
                            Spring dependencies belong in module-app or module-infra.
                            """)
          .allowEmptyShould(true)
          .check(classes);
    }

    /**
     * Metrics and logging are attached by the infrastructure layer (LogicExecutor, dispatchers).
     */
    @Test
    @DisplayName("Core should not depend on Micrometer or logging")
    void coreShouldNotDependOnObservability() {
      noClasses()
          .that()
          .resideInAPackage("crowd.ledger.core..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("io.micrometer..")
          .orShould()
          .dependOnClassesThat()
          .resideInAPackage("org.slf4j..")
          .because(
              """
                            Core module must be monitoring-agnostic.
                            Micrometer and SLF4J belong in module-infra.
                            """)
          .allowEmptyShould(true)
          .check(classes);
    }

    @Test
    @DisplayName("Core should not depend on infrastructure adapters")
    void coreShouldNotDependOnInfrastructure() {
      noClasses()
          .that()
          .resideInAPackage("crowd.ledger.core..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("crowd.ledger.infrastructure..")
          .because("Adapters implement core ports, never the other way around.")
          .allowEmptyShould(true)
          .check(classes);
    }
  }

  @Nested
  @DisplayName("Infrastructure Module: Dependency Direction")
  class InfrastructureModuleTests {

    @Test
    @DisplayName("Infrastructure should not depend on application services or controllers")
    void infrastructureShouldNotDependOnApplicationLayer() {
      noClasses()
          .that()
          .resideInAPackage("crowd.ledger.infrastructure..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("crowd.ledger.service..")
          .orShould()
          .dependOnClassesThat()
          .resideInAPackage("crowd.ledger.controller..")
          .because(
              """
                            Infrastructure should depend on core abstractions (ports).
                            Direct dependency on application services violates DIP.
                            """)
          .allowEmptyShould(true)
          .check(classes);
    }
  }

  @Nested
  @DisplayName("Application Module: Layering")
  class ApplicationModuleTests {

    @Test
    @DisplayName("Controllers should go through services, not the registry or adapters")
    void controllersShouldUseServices() {
      noClasses()
          .that()
          .resideInAPackage("crowd.ledger.controller..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("crowd.ledger.infrastructure..")
          .orShould()
          .dependOnClassesThat()
          .haveFullyQualifiedName("crowd.ledger.core.registry.ProjectRegistry")
          .orShould()
          .dependOnClassesThat()
          .haveFullyQualifiedName("crowd.ledger.core.project.ProjectEscrow")
          .allowEmptyShould(true)
          .check(classes);
    }
  }
}
