package io.intellixity.catchwork.catcher;

import io.intellixity.catchwork.fault.Fault;
import io.intellixity.catchwork.fault.FaultType;

import java.lang.annotation.Annotation;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.*;

/**
 * Target-type inference for catchers.\n
 *
 * Resolution order for {@link #inferTargetType(Catcher)}:\n
 * - {@link TypedCatcher#targetType()}\n
 * - {@link Catches} on the parameter of the catcher's {@code handle(Fault)} method\n
 * - {@link Catches} on the catcher class\n
 * - otherwise {@link FaultType#ROOT_ID} (lambdas always end up here)\n
 */
public final class CatcherTypes {
  private CatcherTypes() {}

  public static String inferTargetType(Catcher catcher) {
    if (catcher == null) throw new IllegalArgumentException("catcher is required");

    if (catcher instanceof TypedCatcher tc) {
      String t = tc.targetType();
      if (t == null || t.isBlank()) throw new IllegalArgumentException("TypedCatcher returned a blank targetType: " + tc);
      return t.trim();
    }

    Class<?> type = catcher.getClass();
    try {
      Method handle = type.getMethod("handle", Fault.class);
      Catches onParam = find(handle.getParameterAnnotations()[0]);
      if (onParam != null) return targetOf(onParam);
    } catch (NoSuchMethodException e) {
      throw new IllegalStateException("Catcher without handle(Fault): " + type.getName(), e);
    }

    Catches onType = type.getAnnotation(Catches.class);
    if (onType != null) return targetOf(onType);

    return FaultType.ROOT_ID;
  }

  /**
   * Turn every public {@link Catches}-annotated method of {@code bean} into a catcher, keyed by
   * target type. Methods are visited by name, so the returned order is stable across JVMs.
   */
  public static Map<String, Catcher> methodCatchers(Object bean) {
    Objects.requireNonNull(bean, "bean");
    List<Method> methods = new ArrayList<>();
    for (Method m : bean.getClass().getMethods()) {
      if (m.isBridge() || m.isSynthetic() || Modifier.isStatic(m.getModifiers())) continue;
      if (m.isAnnotationPresent(Catches.class)) methods.add(m);
    }
    methods.sort(Comparator.comparing(Method::getName).thenComparingInt(Method::getParameterCount));

    Map<String, Catcher> out = new LinkedHashMap<>();
    for (Method m : methods) {
      MethodCatcher mc = new MethodCatcher(bean, m);
      if (out.putIfAbsent(mc.targetType(), mc) != null) {
        throw new IllegalArgumentException("More than one @Catches method for " + mc.targetType() +
            " on " + bean.getClass().getName());
      }
    }
    return out;
  }

  static String targetOf(Catches c) {
    if (!c.value().isBlank()) return c.value().trim();
    return c.type().getName();
  }

  static boolean isExplicit(Catches c) {
    return !c.value().isBlank() || c.type() != Throwable.class;
  }

  private static Catches find(Annotation[] annotations) {
    for (Annotation a : annotations) {
      if (a instanceof Catches c) return c;
    }
    return null;
  }

  /** Catcher backed by a bean method of shape {@code ()}, {@code (Fault)} or {@code (T extends Throwable)}. */
  static final class MethodCatcher implements TypedCatcher {
    private final Object bean;
    private final Method method;
    private final Class<?> paramType;
    private final String targetType;

    MethodCatcher(Object bean, Method method) {
      this.bean = bean;
      this.method = method;
      Catches c = method.getAnnotation(Catches.class);
      int n = method.getParameterCount();
      if (n > 1) throw new IllegalArgumentException("@Catches method must take at most one parameter: " + method);
      this.paramType = n == 0 ? null : method.getParameterTypes()[0];

      if (paramType == null || paramType == Fault.class) {
        this.targetType = targetOf(c);
      } else if (Throwable.class.isAssignableFrom(paramType)) {
        this.targetType = isExplicit(c) ? targetOf(c) : paramType.getName();
      } else {
        throw new IllegalArgumentException("@Catches method parameter must be Fault or a Throwable: " + method);
      }
      method.trySetAccessible();
    }

    @Override
    public String targetType() { return targetType; }

    @Override
    public Object handle(Fault fault) {
      Object[] args;
      if (paramType == null) args = new Object[0];
      else if (paramType == Fault.class) args = new Object[]{fault};
      else {
        Throwable cause = fault == null ? null : fault.cause();
        args = new Object[]{paramType.isInstance(cause) ? cause : null};
      }

      try {
        return method.invoke(bean, args);
      } catch (InvocationTargetException e) {
        Throwable t = e.getCause();
        if (t instanceof RuntimeException re) throw re;
        if (t instanceof Error err) throw err;
        throw new CatcherInvocationException("Catcher method failed: " + method, t);
      } catch (IllegalAccessException e) {
        throw new CatcherInvocationException("Catcher method not accessible: " + method, e);
      }
    }

    @Override
    public String toString() {
      return "MethodCatcher[" + targetType + " -> " + method.getDeclaringClass().getSimpleName() + "#" + method.getName() + "]";
    }
  }
}
