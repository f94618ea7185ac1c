package com.ciro.viewc;

import com.ciro.viewc.target.Instr;
import com.tngtech.archunit.core.domain.JavaClass;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchCondition;
import com.tngtech.archunit.lang.ArchRule;
import com.tngtech.archunit.lang.ConditionEvents;
import com.tngtech.archunit.lang.SimpleConditionEvent;
import org.slf4j.Logger;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.fields;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@AnalyzeClasses(packages = "com.ciro.viewc", importOptions = ImportOption.DoNotIncludeTests.class)
public class ViewcRulesTest {

    static final ArchCondition<JavaClass> BE_RECORDS =
            new ArchCondition<JavaClass>("ser un record") {
                @Override
                public void check(JavaClass item, ConditionEvents events) {
                    if (!item.reflect().isRecord()) {
                        String msg = item.getName() + " no es record (las instrucciones se comparan por valor)";
                        events.add(SimpleConditionEvent.violated(item, msg));
                    }
                }
            };

    // 1. El AST no conoce las fases posteriores
    @ArchTest
    static final ArchRule ast_is_a_leaf = noClasses()
            .that().resideInAPackage("..viewc.ast..")
            .should().dependOnClassesThat().resideInAnyPackage("..viewc.lower..", "..viewc.synth..", "..viewc.deps..", "..viewc.target..")
            .because("El parser entrega el AST sin saber cómo se baja.");

    // 2. El programa destino no depende de quien lo genera
    @ArchTest
    static final ArchRule target_does_not_know_lowering = noClasses()
            .that().resideInAPackage("..viewc.target..")
            .should().dependOnClassesThat().resideInAnyPackage("..viewc.lower..", "..viewc.synth..", "..viewc.deps..");

    // 3. Lowering antes que síntesis
    @ArchTest
    static final ArchRule lowering_does_not_use_synthesis = noClasses()
            .that().resideInAPackage("..viewc.lower..")
            .should().dependOnClassesThat().resideInAPackage("..viewc.synth..");

    @ArchTest
    static final ArchRule spi_stays_small = noClasses()
            .that().resideInAPackage("..viewc.spi..")
            .should().dependOnClassesThat().resideInAnyPackage("..viewc.lower..", "..viewc.synth..");

    // 4. Instrucciones inmutables
    @ArchTest
    static final ArchRule instructions_are_records = classes()
            .that().implement(Instr.class)
            .should(BE_RECORDS)
            .because("Los tests y la deduplicación comparan instrucciones con equals.");

    // 5. Errores con nombre reconocible
    @ArchTest
    static final ArchRule exceptions_are_named = classes()
            .that().areAssignableTo(RuntimeException.class)
            .should().haveSimpleNameEndingWith("Exception")
            .orShould().haveSimpleNameEndingWith("Defect");

    // 6. Un logger por clase
    @ArchTest
    static final ArchRule loggers_are_private_static_final = fields()
            .that().haveRawType(Logger.class)
            .should().bePrivate()
            .andShould().beStatic()
            .andShould().beFinal()
            .allowEmptyShould(true);
}
