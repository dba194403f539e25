/**
 * Syllabifier capability and the built-in Spanish implementation.
 */
package com.phillippitts.fonemas.service.syllabify;
