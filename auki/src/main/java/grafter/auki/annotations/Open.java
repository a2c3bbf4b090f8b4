// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.auki.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as designed for subclassing, or a method as designed for overriding.
 * <p>
 * The {@link grafter.auki.FinalityProcessor} rejects every concrete class that is neither {@code final} nor
 * {@code @Open}, and every overridable method of an open class that is neither {@code final}, abstract, a default
 * method, nor {@code @Open}.
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface Open {
}
