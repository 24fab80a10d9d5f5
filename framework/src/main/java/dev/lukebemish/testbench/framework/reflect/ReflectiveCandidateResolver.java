package dev.lukebemish.testbench.framework.reflect;

import dev.lukebemish.testbench.framework.discovery.Candidate;
import dev.lukebemish.testbench.framework.discovery.CandidateResolver;
import dev.lukebemish.testbench.framework.discovery.ClassSelector;
import dev.lukebemish.testbench.framework.discovery.DiscoveryException;
import dev.lukebemish.testbench.framework.discovery.PackageSelector;
import dev.lukebemish.testbench.framework.discovery.Selector;
import dev.lukebemish.testbench.framework.model.ContainerLifecycle;
import dev.lukebemish.testbench.framework.model.TestAction;
import dev.lukebemish.testbench.framework.model.TestSource;
import org.jspecify.annotations.Nullable;
import org.junit.platform.commons.support.AnnotationSupport;
import org.junit.platform.commons.support.HierarchyTraversalMode;
import org.junit.platform.commons.support.ModifierSupport;
import org.junit.platform.commons.support.ReflectionSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.util.List;
import java.util.regex.Pattern;

public class ReflectiveCandidateResolver implements CandidateResolver<Class<?>, Method> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReflectiveCandidateResolver.class);

    private static final Pattern QUALIFIED_NAME = Pattern.compile("\\p{javaJavaIdentifierStart}\\p{javaJavaIdentifierPart}*(\\.\\p{javaJavaIdentifierStart}\\p{javaJavaIdentifierPart}*)*");

    @Override
    public List<Class<?>> scan(Selector selector) {
        if (selector instanceof PackageSelector packageSelector) {
            var packageName = packageSelector.packageName();
            if (!packageName.isEmpty() && !QUALIFIED_NAME.matcher(packageName).matches()) {
                throw new DiscoveryException("Invalid package name '" + packageName + "'");
            }
            return ReflectionSupport.findAllClassesInPackage(packageName, type -> true, name -> true);
        } else if (selector instanceof ClassSelector classSelector) {
            var className = classSelector.className();
            if (!QUALIFIED_NAME.matcher(className).matches()) {
                throw new DiscoveryException("Invalid class name '" + className + "'");
            }
            try {
                Class<?> type = ReflectionSupport.tryToLoadClass(className).toOptional()
                    .orElseThrow(() -> new DiscoveryException("Could not load class '" + className + "'"));
                return List.of(type);
            } catch (LinkageError e) {
                throw new DiscoveryException("Could not load class '" + className + "': " + e, e);
            }
        }
        throw new DiscoveryException("Unsupported selector " + selector.describe());
    }

    @Override
    public boolean isContainer(Class<?> candidate) {
        return AnnotationSupport.isAnnotated(candidate, TestContainer.class)
            && !ModifierSupport.isAbstract(candidate)
            && !candidate.isInterface()
            && !candidate.isAnonymousClass()
            && !candidate.isLocalClass()
            && (candidate.getEnclosingClass() == null || ModifierSupport.isStatic(candidate));
    }

    @Override
    public List<Method> members(Class<?> container) {
        return findMethods(container, TestUnit.class, HierarchyTraversalMode.TOP_DOWN);
    }

    @Override
    public boolean isLeaf(Method candidate) {
        if (ModifierSupport.isStatic(candidate) || ModifierSupport.isAbstract(candidate) || candidate.getParameterCount() != 0) {
            LOGGER.warn("Ignoring {}.{}: @TestUnit methods must be non-static, concrete and take no parameters",
                candidate.getDeclaringClass().getName(), candidate.getName());
            return false;
        }
        return true;
    }

    @Override
    public Candidate describeContainer(Class<?> container) {
        var displayName = AnnotationSupport.findAnnotation(container, TestContainer.class)
            .map(TestContainer::displayName)
            .filter(name -> !name.isBlank())
            .orElse(container.getSimpleName());
        return new Candidate(container.getName(), displayName, TestSource.ofContainer(container.getName()));
    }

    @Override
    public Candidate describeLeaf(Class<?> container, Method leaf) {
        var displayName = AnnotationSupport.findAnnotation(leaf, TestUnit.class)
            .map(TestUnit::displayName)
            .filter(name -> !name.isBlank())
            .orElse(leaf.getName());
        return new Candidate(leaf.getName(), displayName, TestSource.ofUnit(container.getName(), leaf.getName()));
    }

    @Override
    public TestAction bind(Class<?> container, Method leaf) {
        return () -> {
            Object instance = ReflectionSupport.newInstance(container);
            ReflectionSupport.invokeMethod(leaf, instance);
        };
    }

    @Override
    public ContainerLifecycle lifecycle(Class<?> container) {
        return new ContainerLifecycle(
            staticHooks(container, BeforeContainer.class, HierarchyTraversalMode.TOP_DOWN),
            staticHooks(container, AfterContainer.class, HierarchyTraversalMode.BOTTOM_UP)
        );
    }

    private static List<Method> findMethods(Class<?> container, Class<? extends Annotation> annotation, HierarchyTraversalMode order) {
        try {
            return ReflectionSupport.findMethods(container, method -> AnnotationSupport.isAnnotated(method, annotation), order);
        } catch (LinkageError e) {
            throw new DiscoveryException("Could not read @" + annotation.getSimpleName() + " methods of " + container.getName() + ": " + e, e);
        }
    }

    private static @Nullable TestAction staticHooks(Class<?> container, Class<? extends Annotation> annotation, HierarchyTraversalMode order) {
        List<Method> hooks = findMethods(container, annotation, order);
        for (Method hook : hooks) {
            if (!ModifierSupport.isStatic(hook) || hook.getParameterCount() != 0) {
                throw new DiscoveryException("@" + annotation.getSimpleName() + " method " + container.getName() + "." + hook.getName() + " must be static and take no parameters");
            }
        }
        if (hooks.isEmpty()) {
            return null;
        }
        return () -> {
            for (Method hook : hooks) {
                ReflectionSupport.invokeMethod(hook, null);
            }
        };
    }
}
