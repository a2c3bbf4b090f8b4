// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.auki;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic;
import grafter.auki.annotations.Open;

/**
 * Compile-time check that every class is either closed for extension or explicitly designed for it.
 * <p>
 * Runs on every root element of every round and never claims any annotation, so it coexists with other processors.
 */
@SupportedAnnotationTypes("*")
public final class FinalityProcessor extends AbstractProcessor {
    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(final Set<? extends TypeElement> annotations, final RoundEnvironment roundEnv) {
        for (final var element : roundEnv.getRootElements()) {
            checkElement(element);
        }
        return false;
    }

    private void checkElement(final Element element) {
        if (!(element instanceof TypeElement type)) {
            return;
        }
        switch (type.getKind()) {
            case ENUM, RECORD, ANNOTATION_TYPE -> checkClosedType(type);
            case INTERFACE -> checkMembers(type, this::checkInterfaceMethod);
            default -> checkClass(type);
        }
        for (final var member : type.getEnclosedElements()) {
            checkElement(member);
        }
    }

    private void checkClass(final TypeElement type) {
        final var modifiers = type.getModifiers();
        if (isDeclaredOpen(type)) {
            if (modifiers.contains(Modifier.FINAL)) {
                report(Diagnostic.Kind.ERROR, "A class declared open cannot also be final", type);
            }
            if (!Collections.disjoint(modifiers, implicitlyOpen) && hasOpenAnnotation(type)) {
                report(Diagnostic.Kind.WARNING, "@Open is implied for abstract, sealed and non-sealed classes", type);
            }
            checkMembers(type, this::checkOpenClassMethod);
        } else {
            if (!modifiers.contains(Modifier.FINAL)) {
                report(Diagnostic.Kind.ERROR, "Class is neither final, abstract, sealed nor @Open", type);
            }
            checkClosedType(type);
        }
    }

    private void checkClosedType(final TypeElement type) {
        if (hasOpenAnnotation(type)) {
            report(Diagnostic.Kind.ERROR, "Enums, records and final classes cannot be @Open", type);
        }
        checkMembers(type, method -> {
            if (isInstanceMember(method) && hasOpenAnnotation(method)) {
                report(Diagnostic.Kind.ERROR, "Methods of a closed type cannot be @Open", method);
            }
        });
    }

    private void checkOpenClassMethod(final ExecutableElement method) {
        if (!isInstanceMember(method)) {
            return;
        }
        final var modifiers = method.getModifiers();
        final var isFinal = modifiers.contains(Modifier.FINAL);
        final var isAbstract = modifiers.contains(Modifier.ABSTRACT);
        final var isOpen = isAbstract || hasOpenAnnotation(method);
        if (isFinal && isOpen) {
            report(Diagnostic.Kind.ERROR, "A method cannot be both final and overridable", method);
        } else if (!isFinal && !isOpen) {
            report(Diagnostic.Kind.ERROR, "Method of an open class is neither final, abstract nor @Open", method);
        }
        if (isAbstract && hasOpenAnnotation(method)) {
            report(Diagnostic.Kind.WARNING, "@Open is implied for abstract methods", method);
        }
    }

    private void checkInterfaceMethod(final ExecutableElement method) {
        if (method.getModifiers().contains(Modifier.DEFAULT) && hasOpenAnnotation(method)) {
            report(Diagnostic.Kind.WARNING, "@Open is implied for default methods", method);
        }
    }

    private boolean isInstanceMember(final ExecutableElement method) {
        final var modifiers = method.getModifiers();
        if (modifiers.contains(Modifier.STATIC) || modifiers.contains(Modifier.PRIVATE)) {
            if (hasOpenAnnotation(method)) {
                report(Diagnostic.Kind.ERROR, "Static and private methods cannot be @Open", method);
            }
            return false;
        }
        return true;
    }

    private void report(final Diagnostic.Kind kind, final String message, final Element element) {
        processingEnv.getMessager().printMessage(kind, message, element);
    }

    private static void checkMembers(final TypeElement type, final MethodCheck check) {
        for (final var member : type.getEnclosedElements()) {
            if (member.getKind() == ElementKind.METHOD && member instanceof ExecutableElement method) {
                check.apply(method);
            }
        }
    }

    private static boolean isDeclaredOpen(final TypeElement type) {
        return !Collections.disjoint(type.getModifiers(), implicitlyOpen) || hasOpenAnnotation(type);
    }

    private static boolean hasOpenAnnotation(final Element element) {
        return element.getAnnotation(Open.class) != null;
    }

    private static final EnumSet<Modifier> implicitlyOpen =
        EnumSet.of(Modifier.ABSTRACT, Modifier.SEALED, Modifier.NON_SEALED);

    @FunctionalInterface
    private interface MethodCheck {
        void apply(ExecutableElement method);
    }
}
