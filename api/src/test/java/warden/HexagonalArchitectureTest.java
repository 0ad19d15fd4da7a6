package warden;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@DisplayName("Hexagonal Architecture Rules")
class HexagonalArchitectureTest {

    private static JavaClasses importedClasses;

    @BeforeAll
    static void setUp() {
        importedClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("warden");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapter")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("warden.core..")
                    .should().dependOnClassesThat().resideInAPackage("warden.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on system")
        void coreShouldNotDependOnSystem() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("warden.core..")
                    .should().dependOnClassesThat().resideInAPackage("warden.system..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Outbound ports should be interfaces")
        void outboundPortsShouldBeInterfaces() {
            ArchRule rule = classes()
                    .that().resideInAPackage("warden.core.port.out..")
                    .should().beInterfaces();

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Model should not depend on services or ports")
        void modelShouldNotDependOnServices() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("warden.core.model..")
                    .should().dependOnClassesThat()
                    .resideInAnyPackage("warden.core.service..", "warden.core.port..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Adapter Layer Rules")
    class AdapterLayerRules {

        @Test
        @DisplayName("Adapter should not depend on system")
        void adapterShouldNotDependOnSystem() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("warden.adapter..")
                    .should().dependOnClassesThat().resideInAPackage("warden.system..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("SPI Rules")
    class SpiRules {

        @Test
        @DisplayName("SPI should not depend on adapter or services")
        void spiShouldNotDependOnImplementations() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("warden.spi..")
                    .should().dependOnClassesThat()
                    .resideInAnyPackage("warden.adapter..", "warden.core.service..", "warden.system..");

            rule.check(importedClasses);
        }
    }
}
