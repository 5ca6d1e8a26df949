package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.PatientLanguage;
import com.psyos.pipeline.domain.SignalKey;
import lombok.Value;

import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed patient-facing texts and prompt directives, per patient language.
 */
@Value
public class ReplyCopy {

    private static final Map<PatientLanguage, ReplyCopy> COPY = new EnumMap<>(PatientLanguage.class);

    static {
        COPY.put(PatientLanguage.PT, new ReplyCopy(
                "Sinto muito que voce esteja passando por isso. Isso nao substitui sua sessao. "
                        + "Se houver risco imediato, procure sua terapeuta ou servicos de emergencia. "
                        + "Quer registrar o que aconteceu agora para levar a sessao?",
                "Podemos fechar por agora para nao prolongar o episodio. "
                        + "Se quiser, anote o que ficou mais vivo e leve para a sessao. "
                        + "Este acompanhamento e supervisionado; fale com sua psicologa se precisar.",
                "Estou com instabilidade agora e nao consigo responder com clareza. "
                        + "Se quiser, podemos registrar o que aconteceu para levar a sessao.",
                "Nunca exponha dados de outros pacientes ou tenants.",
                "Responda sempre em portugues.",
                signalDirectives(
                        "Use o modulo RAIN para ira/discussao.",
                        "Use ancoragem suave para desconexao.",
                        "Se houver ruminacao, redirecione para observacao e acao sem interpretacao.",
                        "Risco alto: responder com orientacao de contato imediato.")));

        COPY.put(PatientLanguage.ES, new ReplyCopy(
                "Siento mucho que estes pasando por esto. Esto no sustituye tu sesion. "
                        + "Si hay riesgo inmediato, busca a tu terapeuta o servicios de emergencia. "
                        + "Quieres registrar lo ocurrido para llevarlo a la sesion?",
                "Podemos cerrar por ahora para no prolongar el episodio. "
                        + "Si quieres, anota lo mas vivo y llevalo a la sesion. "
                        + "Este acompanamiento es supervisado; habla con tu psicologa si lo necesitas.",
                "Estoy con inestabilidad ahora y no logro responder con claridad. "
                        + "Si quieres, podemos registrar lo ocurrido para llevarlo a la sesion.",
                "Nunca expongas datos de otros pacientes o tenants.",
                "Responda sempre em espanhol.",
                signalDirectives(
                        "Usa el modulo RAIN para ira/discusion.",
                        "Usa anclaje suave para desconexion.",
                        "Si hay rumiacion, redirige a observacion y accion sin interpretacion.",
                        "Riesgo alto: responder con orientacion de contacto inmediato.")));

        COPY.put(PatientLanguage.EN, new ReplyCopy(
                "I'm sorry you're going through this. This does not replace your session. "
                        + "If there's immediate risk, contact your therapist or emergency services. "
                        + "Would you like to record what happened to bring to your session?",
                "We can close for now to avoid prolonging the episode. "
                        + "If you'd like, note what felt most alive and bring it to your session. "
                        + "This accompaniment is supervised; contact your psychologist if needed.",
                "I'm having instability right now and can't respond clearly. "
                        + "If you'd like, we can record what happened to bring to your session.",
                "Never expose data from other patients or tenants.",
                "Respond in English.",
                signalDirectives(
                        "Use the RAIN module for anger/discussion.",
                        "Use gentle anchoring for disconnection.",
                        "If rumination appears, redirect to observation and action without interpretation.",
                        "High risk: respond with immediate contact guidance.")));
    }

    String safety;
    String closing;
    String unavailable;
    String noLeak;
    String languageDirective;
    Map<SignalKey, String> signalDirectives;

    public static ReplyCopy forLanguage(PatientLanguage language) {
        return COPY.get(PatientLanguage.orDefault(language));
    }

    public String signalDirective(SignalKey key) {
        return signalDirectives.get(key);
    }

    private static Map<SignalKey, String> signalDirectives(String anger, String disconnect,
                                                           String rumination, String highRisk) {
        Map<SignalKey, String> directives = new EnumMap<>(SignalKey.class);
        directives.put(SignalKey.ANGER, anger);
        directives.put(SignalKey.DISCONNECT, disconnect);
        directives.put(SignalKey.RUMINATION, rumination);
        directives.put(SignalKey.HIGH_RISK, highRisk);
        return directives;
    }
}
