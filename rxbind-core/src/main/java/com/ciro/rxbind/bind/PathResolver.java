package com.ciro.rxbind.bind;

import com.ciro.rxbind.BindingException;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Map;

/**
 * Navega un {@link PropertyPath} sobre un objeto cualquiera. Un miembro que no existe
 * o un valor intermedio null cortan la navegación y el resultado es null.
 */
public final class PathResolver {

    private PathResolver() {}

    public static Object resolve(Object root, PropertyPath path) {
        Object current = root;
        for (String segment : path.segments()) {
            if (current == null) return null;
            current = member(current, segment);
        }
        return current;
    }

    static Object member(Object obj, String name) {
        if (obj instanceof Map<?, ?> m) {
            if (m.containsKey(name)) return m.get(name);
            return m.get(decapitalize(name));
        }

        Class<?> c = obj.getClass();
        Method m = findMethod(c, name);
        if (m == null && !name.equals(decapitalize(name))) m = findMethod(c, decapitalize(name));
        if (m != null) return invoke(m, obj);

        Field f = findField(c, name);
        if (f == null) f = findField(c, decapitalize(name));
        if (f != null) return read(f, obj);

        return null;
    }

    // 1. nombre exacto (records), 2. getX(), 3. isX()
    private static Method findMethod(Class<?> c, String name) {
        Method m = publicNoArg(c, name);
        if (m != null) return m;
        String cap = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        m = publicNoArg(c, "get" + cap);
        if (m != null) return m;
        return publicNoArg(c, "is" + cap);
    }

    private static Method publicNoArg(Class<?> c, String name) {
        try {
            Method m = c.getMethod(name);
            if (m.getReturnType() == void.class || Modifier.isStatic(m.getModifiers())) return null;
            Method visible = accessibleMethod(c, name);
            return visible != null ? visible : m;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    // List.of(..) y compañía: la clase concreta no es pública, List sí
    private static Method accessibleMethod(Class<?> c, String name) {
        if (c == null) return null;
        if (isAccessible(c)) {
            try {
                Method m = c.getMethod(name);
                if (isAccessible(m.getDeclaringClass())) return m;
            } catch (NoSuchMethodException e) {
                return null;
            }
        }
        Method m = accessibleMethod(c.getSuperclass(), name);
        if (m != null) return m;
        for (Class<?> i : c.getInterfaces()) {
            m = accessibleMethod(i, name);
            if (m != null) return m;
        }
        return null;
    }

    private static boolean isAccessible(Class<?> c) {
        return Modifier.isPublic(c.getModifiers()) && c.getModule().isExported(c.getPackageName());
    }

    private static Field findField(Class<?> c, String name) {
        while (c != null && c != Object.class) {
            try {
                Field f = c.getDeclaredField(name);
                if (!Modifier.isStatic(f.getModifiers())) return f;
                return null;
            } catch (NoSuchFieldException e) {
                c = c.getSuperclass();
            }
        }
        return null;
    }

    private static Object invoke(Method m, Object obj) {
        try {
            if (!m.canAccess(obj)) m.setAccessible(true);
            return m.invoke(obj);
        } catch (InvocationTargetException e) {
            throw new BindingException("Member '" + m.getName() + "' of " + obj.getClass().getName()
                    + " threw while resolving a binding path", e.getCause());
        } catch (IllegalAccessException | RuntimeException e) {
            throw new BindingException("Cannot read member '" + m.getName() + "' of " + obj.getClass().getName(), e);
        }
    }

    private static Object read(Field f, Object obj) {
        try {
            if (!f.canAccess(obj)) f.setAccessible(true);
            return f.get(obj);
        } catch (IllegalAccessException | RuntimeException e) {
            throw new BindingException("Cannot read field '" + f.getName() + "' of " + obj.getClass().getName(), e);
        }
    }

    private static String decapitalize(String name) {
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }
}
