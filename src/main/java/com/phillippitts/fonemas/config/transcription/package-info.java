/**
 * Spring wiring of the transcription pipeline and its externalised defaults.
 */
package com.phillippitts.fonemas.config.transcription;
